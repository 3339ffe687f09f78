package com.chih.JQWeb.core.exception;

public class TemplateRecursionException extends JQWebException {
    public TemplateRecursionException(int limit) {
        super("Qweb template infinite recursion: stack depth exceeded " + limit + " frames");
    }
}
