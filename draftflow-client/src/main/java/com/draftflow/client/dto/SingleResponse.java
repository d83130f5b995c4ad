package com.draftflow.client.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * SingleResponse - 携带单个对象的响应
 *
 * @author draftflow
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class SingleResponse<T> extends Response {
    private T data;

    public static <T> SingleResponse<T> of(T data) {
        SingleResponse<T> response = new SingleResponse<>();
        response.setData(data);
        return response;
    }
}
