package kr.weatherbalance.server.web.user;

import jakarta.validation.Valid;
import kr.weatherbalance.server.application.port.in.UserUseCase;
import kr.weatherbalance.server.domain.user.model.User;
import kr.weatherbalance.server.web.common.MessageResponse;
import kr.weatherbalance.server.web.user.dto.CreateUserRequest;
import kr.weatherbalance.server.web.user.dto.UpdateUserRequest;
import kr.weatherbalance.server.web.user.dto.UserResponse;
import kr.weatherbalance.server.web.user.dto.UserUpdatedResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/users")
@RequiredArgsConstructor
public class UserController {

    private final UserUseCase userUseCase;

    @PostMapping("/")
    public ResponseEntity<UserResponse> create(@RequestBody @Valid CreateUserRequest request) {
        var command = new UserUseCase.CreateUserCommand(request.username(), request.balanceOrZero());
        User user = userUseCase.create(command);
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.from(user));
    }

    @GetMapping("/{id}")
    public ResponseEntity<UserResponse> get(@PathVariable("id") Long id) {
        return ResponseEntity.ok(UserResponse.from(userUseCase.get(id)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<UserUpdatedResponse> update(@PathVariable("id") Long id,
                                                      @RequestBody @Valid UpdateUserRequest request) {
        var command = new UserUseCase.UpdateUserCommand(request.username(), request.balance());
        User user = userUseCase.update(id, command);
        return ResponseEntity.ok(new UserUpdatedResponse("User updated successfully", user.id()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<MessageResponse> delete(@PathVariable("id") Long id) {
        userUseCase.delete(id);
        return ResponseEntity.ok(new MessageResponse("User deleted successfully"));
    }

    @GetMapping
    public ResponseEntity<List<UserResponse>> list() {
        List<UserResponse> users = userUseCase.list().stream()
                .map(UserResponse::from)
                .toList();
        return ResponseEntity.ok(users);
    }
}
