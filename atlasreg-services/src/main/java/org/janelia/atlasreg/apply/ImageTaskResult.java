package org.janelia.atlasreg.apply;

public class ImageTaskResult {
    private final ImageTask task;
    private final Throwable error;

    private ImageTaskResult(ImageTask task, Throwable error) {
        this.task = task;
        this.error = error;
    }

    public static ImageTaskResult success(ImageTask task) {
        return new ImageTaskResult(task, null);
    }

    public static ImageTaskResult failure(ImageTask task, Throwable error) {
        return new ImageTaskResult(task, error);
    }

    public ImageTask getTask() {
        return task;
    }

    public boolean isSuccessful() {
        return error == null;
    }

    public Throwable getError() {
        return error;
    }

    @Override
    public String toString() {
        return task.getInput() + (error == null ? " -> " + task.getOutput() : " failed: " + error.getMessage());
    }
}
