package com.assetdna.tracker.service.io;

import com.assetdna.tracker.exception.UnsupportedFormatException;
import org.springframework.http.MediaType;

import java.util.Locale;

/**
 * Wire formats accepted by import and produced by export.
 */
public enum DataFormat {
    CSV("csv", new MediaType("text", "csv")),
    JSON("json", MediaType.APPLICATION_JSON),
    XML("xml", MediaType.APPLICATION_XML);

    private final String extension;
    private final MediaType mediaType;

    DataFormat(String extension, MediaType mediaType) {
        this.extension = extension;
        this.mediaType = mediaType;
    }

    public String getExtension() {
        return extension;
    }

    public MediaType getMediaType() {
        return mediaType;
    }

    public static DataFormat parse(String value) {
        if (value == null || value.isBlank()) {
            throw new UnsupportedFormatException("No format given; expected one of csv, json, xml");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnsupportedFormatException("Unsupported format '" + value + "'; expected one of csv, json, xml");
        }
    }
}
