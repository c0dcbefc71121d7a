package com.al.graphsubscriptions.model.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Category of remote entity being watched. Determines the notification path, the correlation tag prefix
 * and whether the short or long validity window applies.
 */
public enum ResourceClass {
    CHAT_MESSAGES("chat", "/webhook/teams"),
    MAIL_MESSAGES("mail", "/webhook/outlook"),
    CHANNEL_MESSAGES("channel", "/webhook/teams-channels");

    private final String tag;
    private final String notificationPath;

    ResourceClass(String tag, String notificationPath) {
        this.tag = tag;
        this.notificationPath = notificationPath;
    }

    public String getTag() {
        return tag;
    }

    public String getNotificationPath() {
        return notificationPath;
    }

    public boolean isLongLived() {
        return this == MAIL_MESSAGES;
    }

    public String resourceForUser(String userPrincipalName) {
        switch (this) {
            case CHAT_MESSAGES:
                return "users/" + userPrincipalName + "/chats/getAllMessages";
            case MAIL_MESSAGES:
                return "users/" + userPrincipalName + "/messages";
            default:
                throw new IllegalArgumentException("Channel subscriptions are scoped to a team");
        }
    }

    public static String resourceForTeam(String teamId) {
        return "teams/" + teamId + "/channels/getAllMessages";
    }

    /**
     * Classifies a stored resource string. A mail resource denotes "messages" but not "chats"; the match is
     * case-sensitive, so "channels/getAllMessages" is not mail.
     */
    public static ResourceClass fromResource(String resource) {
        if (resource == null) {
            throw new IllegalArgumentException("resource must not be null");
        }
        if (resource.contains("messages") && !resource.contains("chats")) {
            return MAIL_MESSAGES;
        }
        if (resource.startsWith("teams/")) {
            return CHANNEL_MESSAGES;
        }
        return CHAT_MESSAGES;
    }

    public static Optional<ResourceClass> fromTag(String tag) {
        return Arrays.stream(values())
                .filter(rc -> rc.tag.equals(tag))
                .findFirst();
    }
}
