package com.adflux.services.adplatforms.config;

import com.adflux.services.adplatforms.constants.Platform;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Path and query binding of platform tags ("meta", "tiktok", ...).
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, Platform.class, Platform::fromValue);
    }
}
