package com.photocheck.sdk.quality;

import com.photocheck.sdk.config.ValidatorConfig;

/**
 * Default booth registry: seven required checks, then the advisory ones the config enables.
 */
public final class ValidatorFactory {

    private ValidatorFactory() {}

    public static ValidatorRegistry createRegistry(ValidatorConfig config) {
        ValidatorRegistry registry = new ValidatorRegistry();
        registry.register(new BrightnessValidator());
        registry.register(new SharpnessValidator());
        registry.register(new FacePositionValidator());
        registry.register(new FacialExpressionValidator());
        registry.register(new EyeVisibilityValidator());
        registry.register(new ReflectionValidator());
        registry.register(new ShadowValidator());
        if (config.backgroundEnabled) registry.registerAdvisory(new BackgroundValidator());
        if (config.headwearEnabled)   registry.registerAdvisory(new HeadwearValidator());
        return registry;
    }
}
