package io.github.eutro.wasmslice.core.cfg;

import org.jetbrains.annotations.NotNull;

/**
 * The identity of an instruction, or of a merge block.
 * <p>
 * Labels are ordered by section, then by id.
 */
public final class Label implements Comparable<Label> {
    /**
     * The namespace of a label.
     */
    public enum Section {
        /**
         * An instruction of the analysed function.
         */
        FUNCTION,
        /**
         * A merge block, with the block index as id.
         */
        MERGE,
        /**
         * A placeholder instruction generated by slicing.
         */
        SYNTHETIC,
    }

    public final Section section;
    public final int id;

    private Label(Section section, int id) {
        this.section = section;
        this.id = id;
    }

    public static Label of(int id) {
        return new Label(Section.FUNCTION, id);
    }

    public static Label merge(int blockIndex) {
        return new Label(Section.MERGE, blockIndex);
    }

    public static Label synthetic(int id) {
        return new Label(Section.SYNTHETIC, id);
    }

    @Override
    public int compareTo(@NotNull Label o) {
        int c = section.compareTo(o.section);
        return c != 0 ? c : Integer.compare(id, o.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Label label = (Label) o;
        return id == label.id && section == label.section;
    }

    @Override
    public int hashCode() {
        return section.hashCode() * 31 + id;
    }

    @Override
    public String toString() {
        switch (section) {
            case MERGE:
                return "merge" + id;
            case SYNTHETIC:
                return "synth" + id;
            default:
                return Integer.toString(id);
        }
    }
}
