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

/**
 * How frame values are mapped into the 8-bit display range.
 */
public enum NormalizationMode {
    /** Clip range is the frame's own minimum and maximum */
    AUTO_WINDOW,

    /** Clip range is level - width/2 .. level + width/2 */
    EXPLICIT_WINDOW,

    /** Values are clamped into 0..255 as is, without rescaling */
    RAW_PASSTHROUGH
}
