package com.cfgsketch.engine.config;

import com.google.gson.annotations.SerializedName;

/**
 * Deserialized form of an optional extractor config.json.
 * Every field may be absent; the getters supply the defaults.
 */
public class ExtractorConfig {

    /** Overall character budget for node labels (default: 50). */
    @SerializedName("label_max_length")
    private Integer labelMaxLength;

    /** Budget for the construct detail inside a label, e.g. an if condition (default: 30). */
    @SerializedName("detail_max_length")
    private Integer detailMaxLength;

    /** Spaces per indentation level; a tab counts as two spaces (default: 2). */
    @SerializedName("indent_width")
    private Integer indentWidth;

    /** Whether inter-function call edges are added (default: true). */
    @SerializedName("resolve_calls")
    private Boolean resolveCalls;

    /** Language tag used when the caller supplies none (default: "javascript"). */
    @SerializedName("default_language")
    private String defaultLanguage;

    @SerializedName("layout")
    private LayoutSettings layout;

    public static ExtractorConfig defaults() {
        return new ExtractorConfig();
    }

    public int getLabelMaxLength()     { return labelMaxLength != null ? labelMaxLength : 50; }
    public int getDetailMaxLength()    { return detailMaxLength != null ? detailMaxLength : 30; }
    public int getIndentWidth()        { return indentWidth != null && indentWidth > 0 ? indentWidth : 2; }
    public boolean isResolveCalls()    { return resolveCalls == null || resolveCalls; }
    public String getDefaultLanguage() { return defaultLanguage != null ? defaultLanguage : "javascript"; }
    public LayoutSettings getLayout()  { return layout != null ? layout : new LayoutSettings(); }

    public ExtractorConfig withLabelMaxLength(int max) {
        this.labelMaxLength = max;
        return this;
    }

    public ExtractorConfig withDetailMaxLength(int max) {
        this.detailMaxLength = max;
        return this;
    }

    public ExtractorConfig withResolveCalls(boolean resolve) {
        this.resolveCalls = resolve;
        return this;
    }

    /** Fallback layout geometry, in abstract pixel units. */
    public static class LayoutSettings {
        @SerializedName("node_width")        private Integer nodeWidth;
        @SerializedName("node_height")       private Integer nodeHeight;
        @SerializedName("horizontal_gap")    private Integer horizontalGap;
        @SerializedName("vertical_gap")      private Integer verticalGap;
        @SerializedName("disconnected_x")    private Integer disconnectedX;

        public int getNodeWidth()     { return nodeWidth != null ? nodeWidth : 200; }
        public int getNodeHeight()    { return nodeHeight != null ? nodeHeight : 80; }
        public int getHorizontalGap() { return horizontalGap != null ? horizontalGap : 100; }
        public int getVerticalGap()   { return verticalGap != null ? verticalGap : 120; }
        public int getDisconnectedX() { return disconnectedX != null ? disconnectedX : 600; }
    }
}
