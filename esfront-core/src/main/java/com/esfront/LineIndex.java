package com.esfront;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps byte offsets to line/column positions.
 * Lines are 1-based, columns are 0-based byte offsets from the line start.
 */
public final class LineIndex {

    private final int[] lineOffsets; // starting byte offset of each line
    private final int length;

    public LineIndex(String source) {
        List<Integer> offsets = new ArrayList<>();
        offsets.add(0); // line 1 starts at offset 0

        int bytes = 0;
        int i = 0;
        int n = source.length();
        while (i < n) {
            int cp = source.codePointAt(i);
            i += Character.charCount(cp);
            bytes += StringInput.utf8Length(cp);
            if (cp == '\r') {
                // CRLF is a single terminator
                if (i < n && source.charAt(i) == '\n') {
                    i++;
                    bytes++;
                }
                offsets.add(bytes);
            } else if (cp == '\n' || cp == 0x2028 || cp == 0x2029) {
                offsets.add(bytes);
            }
        }

        this.lineOffsets = offsets.stream().mapToInt(Integer::intValue).toArray();
        this.length = bytes;
    }

    public int lineCount() {
        return lineOffsets.length;
    }

    public SourceLocation.Position position(int offset) {
        offset = Math.max(0, Math.min(offset, length));

        // binary search for the last line starting at or before offset
        int low = 0;
        int high = lineOffsets.length - 1;
        int line = 1;
        while (low <= high) {
            int mid = (low + high) / 2;
            if (lineOffsets[mid] <= offset) {
                line = mid + 1;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }

        return new SourceLocation.Position(line, offset - lineOffsets[line - 1]);
    }

    public SourceLocation location(Span span) {
        return new SourceLocation(position(span.lo()), position(span.hi()));
    }
}
