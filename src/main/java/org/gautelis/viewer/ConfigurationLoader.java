/*
 * Copyright (C) 2021 Frode Randers
 * All rights reserved
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.gautelis.viewer;

import org.apache.commons.configuration2.MapConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.ex.ConversionException;
import org.apache.commons.configuration2.io.FileHandler;
import org.gautelis.viewer.render.Interpolation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Locale;
import java.util.Properties;

/**
 * Binds {@link Configuration} to properties, either given programmatically or
 * read from a properties file.
 */
public final class ConfigurationLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

    public static final int MAX_PRERENDER_RADIUS = 5;

    private ConfigurationLoader() {
    }

    public static Configuration defaults() {
        return bindProperties(new Properties());
    }

    public static Configuration bindProperties(Properties properties) {
        return new BoundConfiguration(new MapConfiguration(properties));
    }

    public static Configuration load(File file) throws ConfigurationException {
        PropertiesConfiguration properties = new PropertiesConfiguration();
        new FileHandler(properties).load(file);
        log.debug("Loaded configuration from {}", file.getAbsolutePath());
        return new BoundConfiguration(properties);
    }

    private static final class BoundConfiguration implements Configuration {
        private final org.apache.commons.configuration2.Configuration config;

        private BoundConfiguration(org.apache.commons.configuration2.Configuration config) {
            this.config = config;
        }

        public boolean normalizeOnExtraction() {
            try {
                return config.getBoolean(NORMALIZE_ON_EXTRACTION, false);

            } catch (ConversionException ce) {
                throw invalid(NORMALIZE_ON_EXTRACTION, ce);
            }
        }

        public int samplingThreshold() {
            return atLeast(SAMPLING_THRESHOLD, 500, 0);
        }

        public int maxSampledFrames() {
            return atLeast(MAX_SAMPLED_FRAMES, 200, 1);
        }

        public int progressiveThreshold() {
            return atLeast(PROGRESSIVE_THRESHOLD, 2000, 0);
        }

        public int progressiveWindowSize() {
            return atLeast(PROGRESSIVE_WINDOW_SIZE, 64, 1);
        }

        public int renderCacheSize() {
            return atLeast(RENDER_CACHE_SIZE, 512, 0);
        }

        public int instantCacheSize() {
            return atLeast(INSTANT_CACHE_SIZE, 256, 0);
        }

        public int encodedCacheSize() {
            return atLeast(ENCODED_CACHE_SIZE, 256, 0);
        }

        public int prerenderRadius() {
            return Math.min(MAX_PRERENDER_RADIUS, atLeast(PRERENDER_RADIUS, 3, 0));
        }

        public int prerenderThreads() {
            return atLeast(PRERENDER_THREADS, 2, 1);
        }

        public int prerenderQueueSize() {
            return atLeast(PRERENDER_QUEUE_SIZE, 32, 1);
        }

        public int instantMaxDimension() {
            return atLeast(INSTANT_MAX_DIMENSION, 128, 1);
        }

        public Interpolation finalInterpolation() {
            String value = config.getString(FINAL_INTERPOLATION, Interpolation.BILINEAR.name());
            try {
                return Interpolation.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));

            } catch (IllegalArgumentException iae) {
                throw new IllegalArgumentException("Invalid value for " + FINAL_INTERPOLATION + ": " + value, iae);
            }
        }

        public double defaultWindowWidth() {
            try {
                double width = config.getDouble(DEFAULT_WINDOW_WIDTH, 255.0);
                if (width < 0.0) {
                    throw new IllegalArgumentException("Invalid value for " + DEFAULT_WINDOW_WIDTH + ": " + width);
                }
                return width;

            } catch (ConversionException ce) {
                throw invalid(DEFAULT_WINDOW_WIDTH, ce);
            }
        }

        public double defaultWindowLevel() {
            try {
                return config.getDouble(DEFAULT_WINDOW_LEVEL, 128.0);

            } catch (ConversionException ce) {
                throw invalid(DEFAULT_WINDOW_LEVEL, ce);
            }
        }

        public int defaultZoomPercent() {
            return atLeast(DEFAULT_ZOOM_PERCENT, 100, 1);
        }

        public int minZoomPercent() {
            return atLeast(MIN_ZOOM_PERCENT, 50, 1);
        }

        public int maxZoomPercent() {
            return atLeast(MAX_ZOOM_PERCENT, 300, 1);
        }

        public int maxSeriesExamples() {
            return atLeast(MAX_SERIES_EXAMPLES, 5, 0);
        }

        private int atLeast(String property, int defaultValue, int minimum) {
            int value;
            try {
                value = config.getInt(property, defaultValue);

            } catch (ConversionException ce) {
                throw invalid(property, ce);
            }
            if (value < minimum) {
                throw new IllegalArgumentException(
                        "Invalid value for " + property + ": " + value + " (must be at least " + minimum + ")");
            }
            return value;
        }

        private static IllegalArgumentException invalid(String property, ConversionException ce) {
            return new IllegalArgumentException("Invalid value for " + property + ": " + ce.getMessage(), ce);
        }
    }
}
