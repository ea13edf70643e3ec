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
package org.gautelis.viewer.render;

import java.util.Objects;

/**
 * A window width/level pair, or "auto" when either is absent, in which case the
 * frame's own value range is used.
 */
public final class WindowLevel {
    public static final WindowLevel AUTO = new WindowLevel(null, null);

    private final Double width;
    private final Double level;

    private WindowLevel(Double width, Double level) {
        this.width = width;
        this.level = level;
    }

    public static WindowLevel of(double width, double level) {
        if (width < 0.0 || Double.isNaN(width)) {
            throw new IllegalArgumentException("Window width must be non-negative: " + width);
        }
        if (Double.isNaN(level)) {
            throw new IllegalArgumentException("Window level must be a number");
        }
        return new WindowLevel(width, level);
    }

    /**
     * @return an explicit window if both parameters are given, otherwise {@link #AUTO}
     */
    public static WindowLevel ofNullable(Double width, Double level) {
        if (null == width || null == level) {
            return AUTO;
        }
        return of(width, level);
    }

    public boolean isAuto() {
        return null == width;
    }

    public Double getWidth() {
        return width;
    }

    public Double getLevel() {
        return level;
    }

    /**
     * @return lower bound of the clip range; only defined for explicit windows
     */
    public double getLow() {
        requireExplicit();
        return level - width / 2.0;
    }

    /**
     * @return upper bound of the clip range; only defined for explicit windows
     */
    public double getHigh() {
        requireExplicit();
        return level + width / 2.0;
    }

    private void requireExplicit() {
        if (isAuto()) {
            throw new IllegalStateException("Auto window has no fixed range");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WindowLevel)) {
            return false;
        }
        WindowLevel other = (WindowLevel) o;
        return Objects.equals(width, other.width) && Objects.equals(level, other.level);
    }

    @Override
    public int hashCode() {
        return Objects.hash(width, level);
    }

    @Override
    public String toString() {
        return isAuto() ? "WW/WL auto" : "WW/WL " + width + "/" + level;
    }
}
