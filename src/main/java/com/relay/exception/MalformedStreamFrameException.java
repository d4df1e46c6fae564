package com.relay.exception;

import org.springframework.http.HttpStatus;

/**
 * A streaming frame could not be parsed. Handled inside the normalizer, which skips the frame.
 */
public class MalformedStreamFrameException extends RelayException {

    public MalformedStreamFrameException(String message) {
        super(message);
    }

    public MalformedStreamFrameException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_GATEWAY;
    }

    @Override
    public String getCode() {
        return "malformed_stream_frame";
    }
}
