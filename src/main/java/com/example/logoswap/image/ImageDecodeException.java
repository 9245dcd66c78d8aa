package com.example.logoswap.image;

/**
 * Raised when image or template bytes cannot be turned into a raster.
 */
public class ImageDecodeException extends IllegalArgumentException {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
