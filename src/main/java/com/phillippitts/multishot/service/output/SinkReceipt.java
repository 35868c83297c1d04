package com.phillippitts.multishot.service.output;

import java.util.List;

/**
 * Confirmation returned by a {@link ResultSink}.
 *
 * @param location directory or other address holding the run output (null when nothing was stored)
 * @param files    names of the files written, relative to {@code location}
 */
public record SinkReceipt(String location, List<String> files) {

    public static final SinkReceipt NONE = new SinkReceipt(null, List.of());

    public SinkReceipt {
        files = files == null ? List.of() : List.copyOf(files);
    }
}
