package com.hao.feedhub.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;

/**
 * 全局异常处理器
 *
 * 类职责：
 * 统一捕获 Controller 层抛出的异常，转换为标准化的 API 响应格式。
 *
 * 设计目的：
 * 1. 屏蔽底层异常细节，防止敏感信息泄露给前端。
 * 2. 统一错误码与错误提示。
 *
 * 实现思路：
 * - 非法分页参数（sort_order、direction 等枚举取值错误）抛 IllegalArgumentException，返回 400。
 * - 资源不存在返回 404。
 * - Exception 兜底返回 500。
 * - 限流在过滤器中直接写 429，不经过这里。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理请求参数错误
     *
     * @param e 参数异常
     * @param request 请求上下文
     * @return 标准化错误响应
     */
    @ExceptionHandler({IllegalArgumentException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(Exception e, WebRequest request) {
        log.info("请求参数非法|Bad_request,path={},message={}", getRequestPath(request), e.getMessage());

        Map<String, Object> result = new HashMap<>();
        result.put("code", HttpStatus.BAD_REQUEST.value());
        result.put("message", e.getMessage());
        return result;
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(ResourceNotFoundException e, WebRequest request) {
        log.info("资源不存在|Resource_not_found,path={},message={}", getRequestPath(request), e.getMessage());

        Map<String, Object> result = new HashMap<>();
        result.put("code", HttpStatus.NOT_FOUND.value());
        result.put("message", e.getMessage());
        return result;
    }

    /**
     * 处理系统兜底异常
     *
     * 实现逻辑：
     * 1. 记录 ERROR 级别日志，包含堆栈与请求路径。
     * 2. 返回 500，隐藏具体错误细节。
     */
    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleException(Exception e, WebRequest request) {
        log.error("系统未知异常|System_unknown_error,path={},message={}", getRequestPath(request), e.getMessage(), e);

        Map<String, Object> result = new HashMap<>();
        result.put("code", HttpStatus.INTERNAL_SERVER_ERROR.value());
        result.put("message", "系统繁忙，请联系管理员");
        return result;
    }

    /**
     * 去除 WebRequest 描述中的 "uri=" 前缀
     */
    private String getRequestPath(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }
}
