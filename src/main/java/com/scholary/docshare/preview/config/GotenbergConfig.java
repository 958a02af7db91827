package com.scholary.docshare.preview.config;

import com.scholary.docshare.preview.conversion.GotenbergProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration for the Gotenberg-backed conversion backend. */
@Configuration
@EnableConfigurationProperties(GotenbergProperties.class)
public class GotenbergConfig {}
