package com.msgrelay.core.message;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A user-submitted message as it travels from the HTTP front to the socket listener.
 * The receipt timestamp is not part of this type: the listener stamps it onto the
 * persisted document, so a sender can never choose it.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Message {

    @JsonProperty(MessageConstants.FIELD_USERNAME)
    String username;

    @JsonProperty(MessageConstants.FIELD_MESSAGE)
    String message;

    /**
     * Both fields present and non-empty. Only such messages leave the HTTP front.
     */
    @JsonIgnore
    public boolean isComplete() {
        return username != null && !username.isEmpty()
                && message != null && !message.isEmpty();
    }
}
