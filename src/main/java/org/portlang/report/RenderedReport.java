package org.portlang.report;

import java.util.Arrays;
import java.util.Objects;

/**
 * A rendered report: the suggested file name and the encoded content.
 *
 * @param fileName The file name to write the report to, without a directory.
 * @param content The encoded report.
 */
public record RenderedReport(String fileName, byte[] content) {

    public RenderedReport {
        Objects.requireNonNull(fileName, "fileName");
        content = content.clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public int size() {
        return content.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof RenderedReport other
                && fileName.equals(other.fileName)
                && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return 31 * fileName.hashCode() + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "RenderedReport[fileName=" + fileName + ", size=" + content.length + "]";
    }
}
