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

import java.awt.image.AffineTransformOp;

public enum Interpolation {
    NEAREST_NEIGHBOR(AffineTransformOp.TYPE_NEAREST_NEIGHBOR),
    BILINEAR(AffineTransformOp.TYPE_BILINEAR),
    BICUBIC(AffineTransformOp.TYPE_BICUBIC);

    private final int transformType;

    Interpolation(int transformType) {
        this.transformType = transformType;
    }

    /* package private */
    int getTransformType() {
        return transformType;
    }
}
