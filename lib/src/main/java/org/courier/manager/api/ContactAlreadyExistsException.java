package org.courier.manager.api;

public class ContactAlreadyExistsException extends Exception {

    private final String name;

    public ContactAlreadyExistsException(String name) {
        super("A contact with name " + name + " already exists");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
