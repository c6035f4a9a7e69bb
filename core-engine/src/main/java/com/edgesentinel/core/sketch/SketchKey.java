package com.edgesentinel.core.sketch;

import java.io.Serializable;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Structurally tagged key for a {@link CountMinSketch}.
 *
 * <p>
 * A key is encoded as a one-byte {@link Kind} tag followed by each component
 * as a 4-byte big-endian length and its UTF-8 bytes. The encoding is
 * injective: no two distinct {@code (src, dst)} pairs share an edge key, and
 * an edge key never equals a node key, whatever characters the identifiers
 * contain.
 * </p>
 *
 * @since 1.0.0
 */
public final class SketchKey implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Key space tag. */
    public enum Kind {
        NODE((byte) 1),
        EDGE((byte) 2);

        private final byte tag;

        Kind(byte tag) {
            this.tag = tag;
        }
    }

    private final Kind kind;
    private final byte[] bytes;

    private SketchKey(Kind kind, String... components) {
        this.kind = kind;
        this.bytes = encode(kind, components);
    }

    /**
     * Key for a single node identifier (source or destination).
     *
     * @param node node identifier; must not be {@code null}
     * @return node key
     */
    public static SketchKey node(String node) {
        Objects.requireNonNull(node, "Node identifier must not be null");
        return new SketchKey(Kind.NODE, node);
    }

    /**
     * Key for a directed edge.
     *
     * @param src source identifier; must not be {@code null}
     * @param dst destination identifier; must not be {@code null}
     * @return edge key
     */
    public static SketchKey edge(String src, String dst) {
        Objects.requireNonNull(src, "Source identifier must not be null");
        Objects.requireNonNull(dst, "Destination identifier must not be null");
        return new SketchKey(Kind.EDGE, src, dst);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return a copy of the encoded key bytes
     */
    public byte[] toBytes() {
        return bytes.clone();
    }

    /** Encoded bytes without copying, for hashing inside this package. */
    byte[] encoded() {
        return bytes;
    }

    private static byte[] encode(Kind kind, String... components) {
        byte[][] parts = new byte[components.length][];
        int size = 1;
        for (int i = 0; i < components.length; i++) {
            parts[i] = components[i].getBytes(StandardCharsets.UTF_8);
            size += Integer.BYTES + parts[i].length;
        }
        ByteBuffer buffer = ByteBuffer.allocate(size);
        buffer.put(kind.tag);
        for (byte[] part : parts) {
            buffer.putInt(part.length);
            buffer.put(part);
        }
        return buffer.array();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SketchKey that))
            return false;
        return Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "SketchKey{kind=" + kind + ", length=" + bytes.length + '}';
    }
}
