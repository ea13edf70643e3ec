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

import java.util.Optional;

/**
 * The place where one view is shown. The slot is pointed at a request; views
 * rendered for any other request are discarded, and once the final view for
 * the current request has arrived an instant view no longer replaces it.
 */
public class DisplaySlot {
    private RenderRequest target = null;
    private RenderedView current = null;

    public synchronized void request(RenderRequest request) {
        if (null == target || !target.equals(request)) {
            target = request;
            current = null;
        }
    }

    /**
     * @return true if the view was taken, false if it was stale or superseded
     */
    public synchronized boolean offer(RenderedView view) {
        if (null == target || !target.equals(view.getRequest())) {
            return false;
        }
        if (null != current && current.isFinal() && !view.isFinal()) {
            return false;
        }
        current = view;
        return true;
    }

    public synchronized Optional<RenderedView> getCurrent() {
        return Optional.ofNullable(current);
    }

    public synchronized Optional<RenderRequest> getTarget() {
        return Optional.ofNullable(target);
    }
}
