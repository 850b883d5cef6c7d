package com.example.bulkfile;

import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;

import java.nio.file.Path;

/**
 * Resolves the MIME type a planned file will carry, from its name alone.
 */
public class MimeTypeDetector {
    static final String UNKNOWN = MediaType.OCTET_STREAM.toString();

    private final Tika tika;

    public MimeTypeDetector(Tika tika) {
        this.tika = tika;
    }

    public String detect(Path path) {
        Path name = path.getFileName();
        if (name == null) {
            return UNKNOWN;
        }
        MediaType mediaType = MediaType.parse(tika.detect(name.toString()));
        return mediaType == null ? UNKNOWN : mediaType.getBaseType().toString();
    }
}
