package com.nilsson.imagetagger.service.exif;

import java.io.IOException;

public class MetadataWriteException extends IOException {

    public MetadataWriteException(String message) {
        super(message);
    }

    public MetadataWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
