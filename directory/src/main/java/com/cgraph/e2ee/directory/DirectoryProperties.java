package com.cgraph.e2ee.directory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param lowPrekeyThreshold below this many one-time prekeys a device is told to upload more
 */
@ConfigurationProperties(prefix = "cgraph.directory")
public record DirectoryProperties(@DefaultValue("25") int lowPrekeyThreshold) {}
