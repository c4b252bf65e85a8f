package kr.weatherbalance.server.web.common;

import kr.weatherbalance.server.domain.balance.BalanceUpdateFailedException;
import kr.weatherbalance.server.domain.balance.InvalidBalanceOperationException;
import kr.weatherbalance.server.domain.user.UserNotFoundException;
import kr.weatherbalance.server.domain.user.UserPersistenceException;
import kr.weatherbalance.server.domain.user.UserUpdateFailedException;
import kr.weatherbalance.server.domain.weather.WeatherUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // ========== 사용자 관련 예외 ==========
    @ExceptionHandler(UserNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    ErrorResponse handleUserNotFound(UserNotFoundException e) {
        log.debug("사용자 없음 - userId: {}", e.getUserId());
        return new ErrorResponse("USER_NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(UserUpdateFailedException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    ErrorResponse handleUserUpdateFailed(UserUpdateFailedException e) {
        return new ErrorResponse("USER_UPDATE_FAILED", e.getMessage());
    }

    @ExceptionHandler(UserPersistenceException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    ErrorResponse handleUserPersistence(UserPersistenceException e) {
        return new ErrorResponse("PERSISTENCE_ERROR", e.getMessage());
    }

    // ========== 잔액 변경 관련 예외 ==========
    @ExceptionHandler(WeatherUnavailableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleWeatherUnavailable(WeatherUnavailableException e) {
        log.debug("날씨 조회 실패 응답 - city: {}", e.getCity());
        return new ErrorResponse("WEATHER_UNAVAILABLE", e.getMessage());
    }

    @ExceptionHandler(InvalidBalanceOperationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleInvalidOperation(InvalidBalanceOperationException e) {
        log.debug("잘못된 operation: {}", e.getOperation());
        return new ErrorResponse("INVALID_OPERATION", e.getMessage());
    }

    @ExceptionHandler(BalanceUpdateFailedException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleBalanceUpdateFailed(BalanceUpdateFailedException e) {
        log.warn("잔액 변경 실패 - userId: {}, message: {}", e.getUserId(), e.getMessage());
        return new ErrorResponse("BALANCE_UPDATE_FAILED", e.getMessage());
    }

    // ========== 요청 형식 ==========
    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));
        return new ErrorResponse("INVALID_ARGUMENT", message);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleUnreadable(Exception e) {
        return new ErrorResponse("INVALID_ARGUMENT", "Malformed request");
    }

    // ========== 일반 예외 ==========
    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleIllegalArgument(IllegalArgumentException e) {
        return new ErrorResponse("INVALID_ARGUMENT", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    ErrorResponse handleGenericException(Exception e) {
        log.error("처리되지 않은 예외", e);
        return new ErrorResponse("INTERNAL_ERROR", "Internal server error");
    }
}
