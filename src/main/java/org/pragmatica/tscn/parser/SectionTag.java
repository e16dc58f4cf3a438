package org.pragmatica.tscn.parser;

import java.util.Optional;

/**
 * Section tags of the scene format.
 */
public enum SectionTag {
    GD_SCENE("gd_scene", false),
    EXT_RESOURCE("ext_resource", false),
    SUB_RESOURCE("sub_resource", true),
    NODE("node", true),
    CONNECTION("connection", false),
    EDITABLE("editable", false);

    private final String tag;
    private final boolean carriesProperties;

    SectionTag(String tag, boolean carriesProperties) {
        this.tag = tag;
        this.carriesProperties = carriesProperties;
    }

    public String tag() {
        return tag;
    }

    /**
     * Whether {@code key = value} lines may follow the header.
     */
    public boolean carriesProperties() {
        return carriesProperties;
    }

    public static Optional<SectionTag> fromTag(String tag) {
        for (var value : values()) {
            if (value.tag.equals(tag)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
