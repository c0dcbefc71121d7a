package com.al.graphsubscriptions.service.correlation;

import com.al.graphsubscriptions.model.enums.ResourceClass;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Who a correlation tag was issued for.
 */
@Data
@AllArgsConstructor
public class NotificationOrigin {
    private ResourceClass resourceClass;
    private String userId;
    private String teamId; // null unless channel-scoped
}
