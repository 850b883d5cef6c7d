package com.example.bulkfile;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * Built-in stubs: just enough of each format's header for tools that sniff magic bytes.
 */
public final class TemplateContentStubProvider implements ContentStubProvider {
    private static final byte[] ZIP_HEADER = {0x50, 0x4B, 0x03, 0x04};

    private static final Map<String, byte[]> TEMPLATES = Map.ofEntries(
            Map.entry("application/pdf", ascii("%PDF-1.7\n")),
            Map.entry("image/png", new byte[] {(byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A}),
            Map.entry("image/jpeg", new byte[] {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0}),
            Map.entry("image/gif", ascii("GIF89a")),
            Map.entry("application/zip", ZIP_HEADER),
            Map.entry("application/vnd.openxmlformats-officedocument.wordprocessingml.document", ZIP_HEADER),
            Map.entry("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", ZIP_HEADER),
            Map.entry("application/vnd.openxmlformats-officedocument.presentationml.presentation", ZIP_HEADER),
            Map.entry("application/msword", new byte[] {(byte) 0xD0, (byte) 0xCF, 0x11, (byte) 0xE0,
                    (byte) 0xA1, (byte) 0xB1, 0x1A, (byte) 0xE1}),
            Map.entry("application/rtf", ascii("{\\rtf1\\ansi\n")),
            Map.entry("text/csv", ascii("id,name,value\n")),
            Map.entry("text/html", ascii("<!DOCTYPE html>\n")),
            Map.entry("application/xml", ascii("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n")),
            Map.entry("application/json", ascii("{}\n"))
    );
    private static final byte[] TEXT = ascii("placeholder\n");

    @Override
    public byte[] stubFor(String kind) {
        if (kind == null) {
            return new byte[0];
        }
        String normalized = kind.toLowerCase(Locale.ROOT);
        byte[] template = TEMPLATES.get(normalized);
        if (template != null) {
            return template.clone();
        }
        if (normalized.startsWith("text/")) {
            return TEXT.clone();
        }
        return new byte[0];
    }

    private static byte[] ascii(String value) {
        return value.getBytes(StandardCharsets.ISO_8859_1);
    }
}
