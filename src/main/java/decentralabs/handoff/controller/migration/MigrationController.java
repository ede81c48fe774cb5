package decentralabs.handoff.controller.migration;

import decentralabs.handoff.exception.MigrationException;
import decentralabs.handoff.service.persistence.SchemaMigrationService;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class MigrationController {

    private final SchemaMigrationService migrationService;

    @GetMapping("/migrate")
    public ResponseEntity<Map<String, Object>> migrate() throws MigrationException {
        migrationService.apply();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("message", "Migrations applied");
        return ResponseEntity.ok(response);
    }
}
