package com.healthtrack.query;

import java.util.List;

public record PagedResult<T>(List<T> items, PageMeta pagination) {
}
