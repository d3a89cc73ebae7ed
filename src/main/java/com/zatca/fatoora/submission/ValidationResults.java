package com.zatca.fatoora.submission;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ValidationResults {

    @JsonProperty("status")
    private String status;

    @JsonProperty("infoMessages")
    private List<Message> infoMessages = new ArrayList<>();

    @JsonProperty("warningMessages")
    private List<Message> warningMessages = new ArrayList<>();

    @JsonProperty("errorMessages")
    private List<Message> errorMessages = new ArrayList<>();

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public List<Message> getInfoMessages() { return infoMessages; }
    public void setInfoMessages(List<Message> infoMessages) { this.infoMessages = orEmpty(infoMessages); }

    public List<Message> getWarningMessages() { return warningMessages; }
    public void setWarningMessages(List<Message> warningMessages) { this.warningMessages = orEmpty(warningMessages); }

    public List<Message> getErrorMessages() { return errorMessages; }
    public void setErrorMessages(List<Message> errorMessages) { this.errorMessages = orEmpty(errorMessages); }

    private static List<Message> orEmpty(List<Message> messages) {
        return messages != null ? messages : new ArrayList<>();
    }

    /**
     * A single regulator message
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {

        @JsonProperty("type")
        private String type;

        @JsonProperty("code")
        private String code;

        @JsonProperty("category")
        private String category;

        @JsonProperty("message")
        private String message;

        @JsonProperty("status")
        private String status;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getCode() { return code; }
        public void setCode(String code) { this.code = code; }

        public String getCategory() { return category; }
        public void setCategory(String category) { this.category = category; }

        public String getMessage() { return message; }
        public void setMessage(String message) { this.message = message; }

        public String getStatus() { return status; }
        public void setStatus(String status) { this.status = status; }
    }
}
