package kr.weatherbalance.server.web.balance;

import jakarta.validation.Valid;
import kr.weatherbalance.server.application.port.in.BalanceUpdateUseCase;
import kr.weatherbalance.server.web.balance.dto.BalanceUpdateRequest;
import kr.weatherbalance.server.web.common.MessageResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/update-balance")
@RequiredArgsConstructor
public class BalanceController {

    private final BalanceUpdateUseCase balanceUpdateUseCase;

    @GetMapping("/{operation}/{userId}/{city}")
    public ResponseEntity<MessageResponse> updateByPath(
            @PathVariable("operation") String operation,
            @PathVariable("userId") Long userId,
            @PathVariable("city") String city) {
        var result = balanceUpdateUseCase.updateByPath(operation, userId, city);
        return ResponseEntity.ok(new MessageResponse(result.message()));
    }

    @PostMapping
    public ResponseEntity<MessageResponse> updateByRequest(@RequestBody @Valid BalanceUpdateRequest request) {
        var result = balanceUpdateUseCase.updateByRequest(request.userId(), request.operation(), request.city());
        return ResponseEntity.ok(new MessageResponse(result.message()));
    }
}
