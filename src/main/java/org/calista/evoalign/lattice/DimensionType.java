package org.calista.evoalign.lattice;

/**
 * Dimension kinds as spelled in the lattice document ({@code type:}).
 */
public enum DimensionType {
    SET("set"),
    ORDERED_ENUM("ordered_enum"),
    BOOLEAN("boolean");

    private final String id;

    DimensionType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static DimensionType fromId(String id, String dimensionName) {
        if (id != null) {
            for (DimensionType t : values()) {
                if (t.id.equals(id)) return t;
            }
        }
        throw new LatticeException("Unknown dimension type '" + id + "' for '" + dimensionName + "'");
    }
}
