package com.clipflow.publisher.util;

public final class AppConstants {
    private AppConstants() {}

    // Service names carried by remote errors
    public static final String SERVICE_FACEBOOK = "Facebook Graph";
    public static final String SERVICE_ASSEMBLY_AI = "AssemblyAI";
    public static final String SERVICE_OPENAI = "OpenAI";

    // Analytics error log types
    public static final String ERROR_TOKEN = "token_unavailable";
    public static final String ERROR_POST_ANALYTICS = "update_post_analytics";

    public static final String NO_CREDENTIALS_REASON = "No credentials configured";
    public static final String NO_SPEECH_TRANSCRIPT = "No speech detected in the video.";
}
