package org.dxworks.fortframe.io;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

@JsonPropertyOrder({"unit", "headers", "index_reads", "data_reads", "header_writes", "data_writes"})
public class FileIoSummary {
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public String unit;
    public List<String> headers = new ArrayList<>();
    @JsonProperty("index_reads")
    public List<String> indexReads = new ArrayList<>();
    @JsonProperty("data_reads")
    public List<DataRowGroup> dataReads = new ArrayList<>();
    @JsonProperty("header_writes")
    public List<String> headerWrites = new ArrayList<>();
    @JsonProperty("data_writes")
    public List<DataRowGroup> dataWrites = new ArrayList<>();

    public FileIoSummary(String unit) {
        this.unit = unit;
    }
}
