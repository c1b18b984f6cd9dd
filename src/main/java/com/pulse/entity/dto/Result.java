package com.pulse.entity.dto;

import com.pulse.exception.CallException;
import com.pulse.exception.CallStateException;
import com.pulse.exception.MediaUnavailableException;
import com.pulse.exception.SignalingException;
import lombok.Data;

/**
 * 接口统一返回体
 */
@Data
public class Result {
    public static final int OK = 200;
    /** 参数错误，例如呼叫自己 */
    public static final int BAD_REQUEST = 400;
    /** 当前通话状态不允许该操作，例如没有待接听的来电 */
    public static final int CALL_STATE = 409;
    /** 信令存储或采集设备不可用，稍后可重试 */
    public static final int UNAVAILABLE = 503;
    public static final int SERVER_ERROR = 500;

    private Integer code;
    private String msg;//错误信息
    private Object data;//数据

    public static Result success(){
        Result result = new Result();
        result.code = OK;
        result.msg = "success";
        return result;
    }

    public static Result success(Object data){
        Result result = success();
        result.data = data;
        return result;
    }

    public static Result error(int code, String msg){
        Result result = new Result();
        result.code = code;
        result.msg = msg;
        return result;
    }

    public static Result error(String msg){
        return error(SERVER_ERROR, msg);
    }

    /**
     * 按通话异常的类型选择编码
     */
    public static Result error(CallException ex){
        int code = SERVER_ERROR;
        if (ex instanceof CallStateException) {
            code = CALL_STATE;
        } else if (ex instanceof SignalingException || ex instanceof MediaUnavailableException) {
            code = UNAVAILABLE;
        }
        return error(code, ex.getMessage());
    }

}
