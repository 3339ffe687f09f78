package com.chih.JQWeb.core.impl;

import com.chih.JQWeb.core.spi.RenderMetrics;

public class NoOpRenderMetrics implements RenderMetrics {
    @Override
    public void recordRender(String template, long durationNs, boolean success) {
        // Do nothing
    }
}
