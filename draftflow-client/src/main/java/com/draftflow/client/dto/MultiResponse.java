package com.draftflow.client.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * MultiResponse - 携带列表的响应
 *
 * @author draftflow
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class MultiResponse<T> extends Response {
    private List<T> data = new ArrayList<>();

    public static <T> MultiResponse<T> of(Collection<T> data) {
        MultiResponse<T> response = new MultiResponse<>();
        if (data != null) {
            response.setData(new ArrayList<>(data));
        }
        return response;
    }
}
