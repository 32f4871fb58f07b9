package apimonitor.cooldown;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 冷却记录的ES文档
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CooldownDocument {
    private long endpointId;
    private String notifiedAt;
    private String expiresAt;
}
