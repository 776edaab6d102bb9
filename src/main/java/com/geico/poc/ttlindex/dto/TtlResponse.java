package com.geico.poc.ttlindex.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class TtlResponse {
    private boolean success;
    private Object result;
    private String error;

    public TtlResponse() {
    }

    public TtlResponse(boolean success, Object result) {
        this.success = success;
        this.result = result;
    }

    public static TtlResponse ok(Object result) {
        return new TtlResponse(true, result);
    }

    public static TtlResponse of(boolean success) {
        return new TtlResponse(success, null);
    }

    public static TtlResponse error(String message) {
        TtlResponse response = new TtlResponse();
        response.success = false;
        response.error = message;
        return response;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public Object getResult() {
        return result;
    }

    public void setResult(Object result) {
        this.result = result;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }
}
