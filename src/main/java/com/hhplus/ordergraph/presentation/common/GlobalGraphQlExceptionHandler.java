package com.hhplus.ordergraph.presentation.common;

import com.hhplus.ordergraph.common.exception.BizException;
import com.hhplus.ordergraph.common.exception.ErrorCode;
import com.hhplus.ordergraph.common.exception.InvalidInputException;
import graphql.GraphQLError;
import graphql.GraphqlErrorBuilder;
import graphql.schema.DataFetchingEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.TypeMismatchException;
import org.springframework.core.convert.ConversionException;
import org.springframework.graphql.execution.DataFetcherExceptionResolverAdapter;
import org.springframework.graphql.execution.ErrorType;
import org.springframework.stereotype.Component;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * GlobalGraphQlExceptionHandler - 전역 예외 처리 (Presentation 계층)
 *
 * 역할:
 * - 모든 계층에서 발생한 예외를 GraphQL 에러로 변환
 * - extensions에 에러 코드(code)와 HTTP 상태 코드(status)를 담는다
 *
 * 에러 응답 형식:
 * {
 *   "message": "사용자를 찾을 수 없습니다 | ...",
 *   "path": ["deleteUser"],
 *   "extensions": {
 *     "classification": "NOT_FOUND",
 *     "code": "DOMAIN_USER_NOT_FOUND",
 *     "status": 404
 *   }
 * }
 *
 * 상태 코드 → ErrorType 매핑:
 * - 404: NOT_FOUND (UserNotFoundException, ReferencedEntityNotFoundException 등)
 * - 그 밖의 4xx: BAD_REQUEST (입력 검증 실패, 인자 바인딩 실패, 이메일 중복)
 * - 5xx 및 예상하지 못한 예외: INTERNAL_ERROR
 */
@Component
public class GlobalGraphQlExceptionHandler extends DataFetcherExceptionResolverAdapter {

    private static final Logger logger = LoggerFactory.getLogger(GlobalGraphQlExceptionHandler.class);

    @Override
    protected GraphQLError resolveToSingleError(Throwable ex, DataFetchingEnvironment env) {
        if (ex instanceof BizException) {
            return handleBizException((BizException) ex, env);
        }

        Throwable bindingFailure = findBindingFailure(ex);
        if (bindingFailure != null) {
            return handleBizException(new InvalidInputException(describeBindingFailure(bindingFailure)), env);
        }

        logger.error("[GraphQL] 예상하지 못한 오류: field={}", env.getField().getName(), ex);
        ErrorCode errorCode = ErrorCode.INTERNAL_SERVER_ERROR;
        return GraphqlErrorBuilder.newError(env)
                .errorType(ErrorType.INTERNAL_ERROR)
                .message(errorCode.getMessage())
                .extensions(extensionsOf(errorCode))
                .build();
    }

    private GraphQLError handleBizException(BizException ex, DataFetchingEnvironment env) {
        ErrorCode errorCode = ex.getErrorCode();

        if (errorCode.isClientError()) {
            logger.warn("[GraphQL] 요청 처리 실패: field={}, code={}, message={}",
                    env.getField().getName(), errorCode.getCode(), ex.getMessage());
        } else {
            logger.error("[GraphQL] 서버 처리 실패: field={}, code={}",
                    env.getField().getName(), errorCode.getCode(), ex);
        }

        return GraphqlErrorBuilder.newError(env)
                .errorType(toErrorType(errorCode))
                .message(ex.getMessage())
                .extensions(extensionsOf(errorCode))
                .build();
    }

    /**
     * 인자 바인딩/타입 변환 실패 탐색 (예: UUID 형식이 아닌 id)
     */
    private Throwable findBindingFailure(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof BindException
                    || current instanceof TypeMismatchException
                    || current instanceof ConversionException) {
                return current;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return null;
    }

    private String describeBindingFailure(Throwable failure) {
        if (failure instanceof BindException) {
            String fields = ((BindException) failure).getFieldErrors().stream()
                    .map(FieldError::getField)
                    .distinct()
                    .sorted()
                    .collect(Collectors.joining(", "));
            if (!fields.isEmpty()) {
                return "형식이 올바르지 않은 인자: " + fields;
            }
        }
        if (failure instanceof TypeMismatchException && ((TypeMismatchException) failure).getPropertyName() != null) {
            return "형식이 올바르지 않은 인자: " + ((TypeMismatchException) failure).getPropertyName();
        }
        return "인자 형식이 올바르지 않습니다";
    }

    private ErrorType toErrorType(ErrorCode errorCode) {
        if (errorCode.getStatusCode() == 404) {
            return ErrorType.NOT_FOUND;
        }
        if (errorCode.isClientError()) {
            return ErrorType.BAD_REQUEST;
        }
        return ErrorType.INTERNAL_ERROR;
    }

    private Map<String, Object> extensionsOf(ErrorCode errorCode) {
        return Map.of(
                "code", errorCode.getCode(),
                "status", errorCode.getStatusCode()
        );
    }
}
