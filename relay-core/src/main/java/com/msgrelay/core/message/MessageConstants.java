package com.msgrelay.core.message;

public final class MessageConstants {

    public static final String FIELD_USERNAME = "username";
    public static final String FIELD_MESSAGE = "message";
    public static final String FIELD_DATE = "date";

    private MessageConstants() {
    }
}
