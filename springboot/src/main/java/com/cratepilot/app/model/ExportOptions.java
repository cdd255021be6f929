package com.cratepilot.app.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ExportOptions {

    public enum Format { M3U8, REKORDBOX_XML, SERATO_CSV }

    Format format;
    String outputPath;

    @Builder.Default
    boolean includeMetadata = true;

    @Builder.Default
    boolean relativePaths = false;
}
