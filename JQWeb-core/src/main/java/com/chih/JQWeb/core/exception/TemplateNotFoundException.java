package com.chih.JQWeb.core.exception;

public class TemplateNotFoundException extends JQWebException {

    private final Object reference;

    public TemplateNotFoundException(Object reference) {
        super("Template not found: " + reference);
        this.reference = reference;
    }

    public Object getReference() {
        return reference;
    }
}
