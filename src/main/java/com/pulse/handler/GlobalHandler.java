package com.pulse.handler;


import com.pulse.entity.dto.Result;
import com.pulse.exception.CallException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class GlobalHandler {
    /**
     * 通话业务异常，例如没有待接听的来电、采集设备不可用
     */
    @ExceptionHandler
    public Result exceptionHandler(CallException ex){
        log.warn("通话操作失败：{}", ex.getMessage());
        return Result.error(ex);
    }

    @ExceptionHandler
    public Result exceptionHandler(IllegalArgumentException ex){
        log.warn("参数错误：{}", ex.getMessage());
        return Result.error(Result.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler
    public Result exceptionHandler(Exception ex){
        log.error("异常信息：{}", ex.getMessage(), ex);
        return Result.error(ex.getMessage());
    }
}
