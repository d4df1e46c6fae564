package com.relay.exception;

import org.springframework.http.HttpStatus;

public class ResourceNotFoundException extends RelayException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.NOT_FOUND;
    }

    @Override
    public String getCode() {
        return "not_found";
    }
}
