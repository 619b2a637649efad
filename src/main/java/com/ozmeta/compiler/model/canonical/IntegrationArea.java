package com.ozmeta.compiler.model.canonical;

import java.util.List;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class IntegrationArea {
    @Builder.Default
    List<SourceFieldDefinition> sourceFields = List.of();
    @Builder.Default
    List<MapObjectDefinition> mapObjects = List.of();
    @Builder.Default
    List<MapFieldDefinition> mapFields = List.of();
    @Builder.Default
    List<LineageEdgeDefinition> lineageEdges = List.of();

    public static IntegrationArea empty() {
        return IntegrationArea.builder().build();
    }
}
