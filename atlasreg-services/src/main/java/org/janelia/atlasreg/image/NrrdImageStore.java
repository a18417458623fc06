package org.janelia.atlasreg.image;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import com.google.common.base.Splitter;
import net.imglib2.Cursor;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;
import org.apache.commons.lang3.StringUtils;
import org.janelia.atlasreg.utils.FileUtils;
import org.slf4j.Logger;

/**
 * Image store for 3D NRRD files. Reads raw or gzip encoded data, attached or in a detached data file, with the voxel
 * size taken from "spacings" or from the lengths of the "space directions" vectors. Writes attached data.
 */
public class NrrdImageStore implements ImageStore {

    private static final int CHUNK_VOXELS = 1 << 16;
    private static final Pattern VECTOR_PATTERN = Pattern.compile("\\(([^)]*)\\)");

    private final boolean compress;
    private final Logger logger;

    public NrrdImageStore(boolean compress, Logger logger) {
        this.compress = compress;
        this.logger = logger;
    }

    @Override
    public VolumeImage<?> read(Path imagePath) {
        logger.debug("Read NRRD image {}", imagePath);
        try (InputStream in = new BufferedInputStream(Files.newInputStream(imagePath))) {
            Map<String, String> header = readHeader(in, imagePath);
            NrrdDataType dataType = NrrdDataType.fromName(requiredField(header, "type", imagePath));
            ImageGrid grid = new ImageGrid(readSizes(header, imagePath), readResolution(header, imagePath));
            ByteOrder byteOrder = "big".equalsIgnoreCase(header.get("endian")) ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN;
            VolumeImage<?> image = dataType.allocate(grid);
            String dataFile = header.containsKey("data file") ? header.get("data file") : header.get("datafile");
            if (StringUtils.isNotBlank(dataFile)) {
                Path dataPath = imagePath.toAbsolutePath().getParent().resolve(dataFile.trim());
                try (InputStream dataIn = new BufferedInputStream(Files.newInputStream(dataPath))) {
                    readData(image, decode(dataIn, header, imagePath), dataType, byteOrder);
                }
            } else {
                readData(image, decode(in, header, imagePath), dataType, byteOrder);
            }
            return image;
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading " + imagePath, e);
        } catch (IllegalArgumentException e) {
            throw new UncheckedIOException(new IOException("Invalid NRRD file " + imagePath + ": " + e.getMessage(), e));
        }
    }

    @Override
    public void write(VolumeImage<?> image, Path imagePath) {
        logger.debug("Write NRRD image {} to {}", image, imagePath);
        FileUtils.createParentDirs(imagePath);
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(imagePath))) {
            writeImage(image, out);
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing " + imagePath, e);
        }
    }

    private Map<String, String> readHeader(InputStream in, Path imagePath) throws IOException {
        String magic = readLine(in);
        if (magic == null || !magic.startsWith("NRRD")) {
            throw new IOException(imagePath + " is not a NRRD file");
        }
        Map<String, String> header = new LinkedHashMap<>();
        for (String line = readLine(in); StringUtils.isNotEmpty(line); line = readLine(in)) {
            if (line.startsWith("#")) {
                continue;
            }
            int separator = line.indexOf(':');
            if (separator < 0) {
                continue;
            }
            String value = line.substring(separator + 1);
            if (value.startsWith("=")) {
                // key/value pairs are not interpreted
                continue;
            }
            header.put(line.substring(0, separator).trim().toLowerCase(), value.trim());
        }
        return header;
    }

    private String readLine(InputStream in) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        int b;
        while ((b = in.read()) != -1 && b != '\n') {
            if (b != '\r') {
                line.write(b);
            }
        }
        if (b == -1 && line.size() == 0) {
            return null;
        }
        return line.toString(StandardCharsets.US_ASCII);
    }

    private String requiredField(Map<String, String> header, String field, Path imagePath) throws IOException {
        String value = header.get(field);
        if (StringUtils.isBlank(value)) {
            throw new IOException(imagePath + " has no " + field + " field");
        }
        return value;
    }

    private long[] readSizes(Map<String, String> header, Path imagePath) throws IOException {
        List<String> sizes = Splitter.on(' ').trimResults().omitEmptyStrings().splitToList(requiredField(header, "sizes", imagePath));
        if (sizes.size() != 3) {
            throw new IOException(imagePath + " is not a 3D image: sizes " + sizes);
        }
        return sizes.stream().mapToLong(Long::parseLong).toArray();
    }

    private double[] readResolution(Map<String, String> header, Path imagePath) {
        String spacings = header.get("spacings");
        if (StringUtils.isNotBlank(spacings)) {
            return Splitter.on(' ').trimResults().omitEmptyStrings().splitToList(spacings).stream()
                    .mapToDouble(s -> "nan".equalsIgnoreCase(s) ? 1. : Double.parseDouble(s))
                    .toArray();
        }
        String spaceDirections = header.get("space directions");
        if (StringUtils.isNotBlank(spaceDirections)) {
            double[] resolution = new double[3];
            Matcher m = VECTOR_PATTERN.matcher(spaceDirections);
            int d = 0;
            while (m.find() && d < 3) {
                double squaredLength = 0;
                for (String component : Splitter.on(',').trimResults().splitToList(m.group(1))) {
                    double c = Double.parseDouble(component);
                    squaredLength += c * c;
                }
                resolution[d++] = Math.sqrt(squaredLength);
            }
            if (d == 3) {
                return resolution;
            }
        }
        logger.warn("No voxel size found in {} - use 1um", imagePath);
        return new double[] {1, 1, 1};
    }

    private InputStream decode(InputStream in, Map<String, String> header, Path imagePath) throws IOException {
        String encoding = StringUtils.defaultIfBlank(header.get("encoding"), "raw").toLowerCase();
        InputStream dataStream;
        switch (encoding) {
            case "raw":
                dataStream = in;
                break;
            case "gz":
            case "gzip":
                dataStream = new GZIPInputStream(in, CHUNK_VOXELS);
                break;
            default:
                throw new IOException("Unsupported NRRD encoding " + encoding + " in " + imagePath);
        }
        long byteSkip = Long.parseLong(StringUtils.defaultIfBlank(header.get("byte skip"), "0"));
        if (byteSkip > 0) {
            dataStream.skipNBytes(byteSkip);
        }
        return dataStream;
    }

    private <T extends RealType<T> & NativeType<T>> void readData(VolumeImage<T> image,
                                                                  InputStream in,
                                                                  NrrdDataType dataType,
                                                                  ByteOrder byteOrder) throws IOException {
        Cursor<T> cursor = Views.flatIterable(image.getData()).cursor();
        byte[] chunk = new byte[CHUNK_VOXELS * dataType.getBytes()];
        ByteBuffer buffer = ByteBuffer.wrap(chunk).order(byteOrder);
        long remaining = Intervals.numElements(image.getData());
        while (remaining > 0) {
            int nVoxels = (int) Math.min(remaining, CHUNK_VOXELS);
            int nBytes = nVoxels * dataType.getBytes();
            if (in.readNBytes(chunk, 0, nBytes) < nBytes) {
                throw new EOFException("NRRD data ends " + remaining + " voxels early");
            }
            buffer.clear();
            for (int i = 0; i < nVoxels; i++) {
                cursor.next().setReal(dataType.read(buffer));
            }
            remaining -= nVoxels;
        }
    }

    private <T extends RealType<T> & NativeType<T>> void writeImage(VolumeImage<T> image, OutputStream out) throws IOException {
        NrrdDataType dataType = NrrdDataType.of(image);
        long[] dims = image.getDimensions();
        double[] resolution = image.getResolution();
        String header = "NRRD0004\n" +
                "type: " + dataType.getName() + "\n" +
                "dimension: 3\n" +
                "sizes: " + dims[0] + " " + dims[1] + " " + dims[2] + "\n" +
                "spacings: " + resolution[0] + " " + resolution[1] + " " + resolution[2] + "\n" +
                "encoding: " + (compress ? "gzip" : "raw") + "\n" +
                "endian: little\n" +
                "\n";
        out.write(header.getBytes(StandardCharsets.US_ASCII));
        OutputStream dataOut = compress ? new GZIPOutputStream(out, CHUNK_VOXELS) : out;
        ByteBuffer buffer = ByteBuffer.allocate(CHUNK_VOXELS * dataType.getBytes()).order(ByteOrder.LITTLE_ENDIAN);
        Cursor<T> cursor = Views.flatIterable(image.getData()).cursor();
        while (cursor.hasNext()) {
            if (!buffer.hasRemaining()) {
                dataOut.write(buffer.array(), 0, buffer.position());
                buffer.clear();
            }
            dataType.write(buffer, cursor.next().getRealDouble());
        }
        dataOut.write(buffer.array(), 0, buffer.position());
        if (dataOut instanceof GZIPOutputStream) {
            ((GZIPOutputStream) dataOut).finish();
        }
        dataOut.flush();
    }
}
