package com.camingest.camingest.service.source;

import com.camingest.camingest.model.dto.CameraRegistration;

/**
 * Resolves a discovered (onvif) camera's host and credentials into a pull URL
 * before its worker starts.
 */
public interface StreamDiscovery {

    /**
     * @throws IllegalArgumentException if the registration lacks what discovery needs
     */
    String resolveStreamUrl(CameraRegistration registration);
}
