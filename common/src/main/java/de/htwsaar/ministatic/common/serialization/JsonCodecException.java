package de.htwsaar.ministatic.common.serialization;

/**
 * Ein Objekt ließ sich nicht nach JSON schreiben oder aus JSON lesen.
 */
public class JsonCodecException extends RuntimeException {

    public JsonCodecException(String message, Throwable cause) {

        super(message, cause);
    }
}
