package org.janelia.atlasreg.model;

import java.util.Arrays;

import com.google.common.base.Preconditions;

/**
 * Named landmark given in pixel coordinates of an atlas template.
 */
public class ReferencePoint {
    private final String name;
    private final int[] position;

    public ReferencePoint(String name, int x, int y, int z) {
        Preconditions.checkArgument(name != null, "Reference point name is required");
        this.name = name;
        this.position = new int[] {x, y, z};
    }

    public String getName() {
        return name;
    }

    public int[] getPosition() {
        return position.clone();
    }

    public int get(int axis) {
        return position[axis];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReferencePoint that = (ReferencePoint) o;
        return name.equals(that.name) && Arrays.equals(position, that.position);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + Arrays.hashCode(position);
    }

    @Override
    public String toString() {
        return name + Arrays.toString(position);
    }
}
