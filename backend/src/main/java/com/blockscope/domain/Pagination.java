package com.blockscope.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Pagination(int page, int pageSize, long totalRows) {

    @JsonProperty("totalPages")
    public long totalPages() {
        return totalRows == 0 ? 0 : (totalRows + pageSize - 1) / pageSize;
    }
}
