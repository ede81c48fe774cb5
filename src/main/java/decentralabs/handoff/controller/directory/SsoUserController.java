package decentralabs.handoff.controller.directory;

import decentralabs.handoff.dto.SsoUserResponse;
import decentralabs.handoff.exception.SessionRejectedException;
import decentralabs.handoff.exception.UserNotFoundException;
import decentralabs.handoff.model.SessionPrincipal;
import decentralabs.handoff.model.UserRecord;
import decentralabs.handoff.service.persistence.UserDirectoryService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only directory API for session holders.
 */
@RestController
@RequestMapping("/api/sso-users")
@RequiredArgsConstructor
public class SsoUserController {

    private final UserDirectoryService userDirectoryService;

    @GetMapping("/me")
    public ResponseEntity<Map<String, Object>> me(@AuthenticationPrincipal SessionPrincipal principal)
            throws SessionRejectedException, UserNotFoundException {
        if (principal == null) {
            throw new SessionRejectedException("Unauthorized", "No session cookie found");
        }
        return userResponse(userDirectoryService.findByUserId(principal.userId())
            .orElseThrow(() -> new UserNotFoundException("No directory entry for this session")));
    }

    @GetMapping("/by-email")
    public ResponseEntity<Map<String, Object>> byEmail(@RequestParam String email) throws UserNotFoundException {
        return userResponse(userDirectoryService.findByEmail(email)
            .orElseThrow(() -> new UserNotFoundException("No user with this email")));
    }

    @GetMapping("/by-user-id/{userId}")
    public ResponseEntity<Map<String, Object>> byUserId(@PathVariable String userId) throws UserNotFoundException {
        return userResponse(userDirectoryService.findByUserId(userId)
            .orElseThrow(() -> new UserNotFoundException("No user with this id")));
    }

    @GetMapping("/exists")
    public ResponseEntity<Map<String, Object>> exists(@RequestParam String email) {
        return success(Map.of("exists", userDirectoryService.emailExists(email)));
    }

    @GetMapping("/active")
    public ResponseEntity<Map<String, Object>> active(@RequestParam(defaultValue = "100") int limit,
                                                      @RequestParam(defaultValue = "0") int offset) {
        List<SsoUserResponse> users = userDirectoryService.findActive(limit, offset).stream()
            .map(SsoUserResponse::from)
            .toList();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("users", users);
        data.put("limit", Math.max(1, Math.min(limit, UserDirectoryService.MAX_PAGE_SIZE)));
        data.put("offset", Math.max(0, offset));
        return success(data);
    }

    private ResponseEntity<Map<String, Object>> userResponse(UserRecord user) {
        return success(Map.of("user", SsoUserResponse.from(user)));
    }

    private ResponseEntity<Map<String, Object>> success(Map<String, Object> data) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("data", data);
        return ResponseEntity.ok(response);
    }
}
