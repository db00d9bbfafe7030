package fr.lapetina.mesh.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collection;

/**
 * JSON envelope of every admin API answer: {@code {success, data?, error?, message?, count?}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse {

    private boolean success;
    private Object data;
    private String error;
    private String message;
    private Integer count;

    // Getters and setters
    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public Object getData() { return data; }
    public void setData(Object data) { this.data = data; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public Integer getCount() { return count; }
    public void setCount(Integer count) { this.count = count; }

    public static ApiResponse ok(Object data) {
        ApiResponse api = new ApiResponse();
        api.setSuccess(true);
        api.setData(data);
        if (data instanceof Collection) {
            api.setCount(((Collection<?>) data).size());
        }
        return api;
    }

    public static ApiResponse ok(Object data, String message) {
        ApiResponse api = ok(data);
        api.setMessage(message);
        return api;
    }

    public static ApiResponse error(String error, String message) {
        ApiResponse api = new ApiResponse();
        api.setSuccess(false);
        api.setError(error);
        api.setMessage(message);
        return api;
    }
}
