package com.al.graphsubscriptions.service.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * One page of an OData collection response.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphCollection<T> {

    private List<T> value = new ArrayList<>();

    @JsonProperty("@odata.nextLink")
    private String nextLink;
}
