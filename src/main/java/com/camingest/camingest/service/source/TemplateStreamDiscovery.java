package com.camingest.camingest.service.source;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

import com.camingest.camingest.model.dto.CameraRegistration;

/**
 * Builds the RTSP URL from a template such as
 * {@code rtsp://{username}:{password}@{host}:{port}/}.
 * An explicit source URL in the registration wins over the template.
 */
public class TemplateStreamDiscovery implements StreamDiscovery {

    private final String urlTemplate;
    private final int rtspPort;

    public TemplateStreamDiscovery(String urlTemplate, int rtspPort) {
        this.urlTemplate = urlTemplate;
        this.rtspPort = rtspPort;
    }

    @Override
    public String resolveStreamUrl(CameraRegistration registration) {
        if (registration.getSourceUrl() != null && !registration.getSourceUrl().isBlank()) {
            return registration.getSourceUrl().trim();
        }
        String host = registration.getIpAddress();
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Source type 'onvif' requires an ip_address.");
        }

        String url = urlTemplate
                .replace("{host}", host.trim())
                .replace("{port}", String.valueOf(rtspPort))
                .replace("{username}", encode(registration.getUsername()))
                .replace("{password}", encode(registration.getPassword()));

        // No credentials: drop the empty "user:@" part
        return url.replace("://:@", "://");
    }

    // Percent-encoding for the userinfo part: a space is %20 there, never '+'
    private static String encode(String value) {
        return value == null ? "" : URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
