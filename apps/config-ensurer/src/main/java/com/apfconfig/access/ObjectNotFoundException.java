package com.apfconfig.access;

public class ObjectNotFoundException extends ConfigurationException {

    private final String name;

    public ObjectNotFoundException(String typeName, String name) {
        super(typeName + " " + name + " not found");
        this.name = name;
    }

    public ObjectNotFoundException(String typeName, String name, Throwable cause) {
        super(typeName + " " + name + " not found", cause);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
