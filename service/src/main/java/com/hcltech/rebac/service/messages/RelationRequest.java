package com.hcltech.rebac.service.messages;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of Grant, Revoke, Exists and IsPermitted requests. {@code src_obj} and {@code src_set} are
 * a one-of: at most one may be present.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RelationRequest(
        @JsonProperty("src_obj") EntityMessage srcObj,
        @JsonProperty("src_set") SetMessage srcSet,
        @JsonProperty("dst") SetMessage dst) {

    public static RelationRequest fromEntity(EntityMessage src, SetMessage dst) {
        return new RelationRequest(src, null, dst);
    }

    public static RelationRequest fromSet(SetMessage src, SetMessage dst) {
        return new RelationRequest(null, src, dst);
    }
}
