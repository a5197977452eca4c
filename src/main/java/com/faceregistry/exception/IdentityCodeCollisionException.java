package com.faceregistry.exception;

public class IdentityCodeCollisionException extends RegistryException {

    public IdentityCodeCollisionException(String message) {
        super(message);
    }
}
