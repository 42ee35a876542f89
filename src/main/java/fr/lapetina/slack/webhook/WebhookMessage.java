package fr.lapetina.slack.webhook;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Message posted to an incoming webhook or a {@code response_url}.
 * Null fields are left out of the request body.
 */
public record WebhookMessage(
        String text,
        List<Map<String, Object>> blocks,
        List<Map<String, Object>> attachments,
        @JsonProperty("response_type") String responseType,
        @JsonProperty("replace_original") Boolean replaceOriginal,
        @JsonProperty("delete_original") Boolean deleteOriginal,
        @JsonProperty("thread_ts") String threadTs,
        @JsonProperty("unfurl_links") Boolean unfurlLinks,
        @JsonProperty("unfurl_media") Boolean unfurlMedia
) {
    public WebhookMessage {
        blocks = blocks != null ? List.copyOf(blocks) : null;
        attachments = attachments != null ? List.copyOf(attachments) : null;
    }

    public static WebhookMessage ofText(String text) {
        return builder().text(text).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String text;
        private List<Map<String, Object>> blocks;
        private List<Map<String, Object>> attachments;
        private String responseType;
        private Boolean replaceOriginal;
        private Boolean deleteOriginal;
        private String threadTs;
        private Boolean unfurlLinks;
        private Boolean unfurlMedia;

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder blocks(List<Map<String, Object>> blocks) {
            this.blocks = blocks;
            return this;
        }

        public Builder attachments(List<Map<String, Object>> attachments) {
            this.attachments = attachments;
            return this;
        }

        /**
         * Either {@code in_channel} or {@code ephemeral}.
         */
        public Builder responseType(String responseType) {
            this.responseType = responseType;
            return this;
        }

        public Builder replaceOriginal(Boolean replaceOriginal) {
            this.replaceOriginal = replaceOriginal;
            return this;
        }

        public Builder deleteOriginal(Boolean deleteOriginal) {
            this.deleteOriginal = deleteOriginal;
            return this;
        }

        public Builder threadTs(String threadTs) {
            this.threadTs = threadTs;
            return this;
        }

        public Builder unfurlLinks(Boolean unfurlLinks) {
            this.unfurlLinks = unfurlLinks;
            return this;
        }

        public Builder unfurlMedia(Boolean unfurlMedia) {
            this.unfurlMedia = unfurlMedia;
            return this;
        }

        public WebhookMessage build() {
            return new WebhookMessage(text, blocks, attachments, responseType,
                    replaceOriginal, deleteOriginal, threadTs, unfurlLinks, unfurlMedia);
        }
    }
}
