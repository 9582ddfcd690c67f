package com.apfconfig.access;

public class AlreadyExistsException extends ConflictException {

    public AlreadyExistsException(String typeName, String name, Throwable cause) {
        super(typeName + " " + name + " already exists", cause);
    }
}
