package com.safepocket.categorizer.owner;

import com.safepocket.categorizer.model.Transaction;
import com.safepocket.categorizer.transfer.AccountNumbers;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class OwnerResolver {

    public static final String UNKNOWN_OWNER = "Unknown";

    /**
     * Owner of the transaction's own account: owner map (exact account, then without routing suffix),
     * then the owner the importer attached, then {@value #UNKNOWN_OWNER}.
     */
    public String resolveOwner(Transaction transaction, Map<String, String> ownerMap) {
        String account = transaction.account();
        if (account != null && !account.isBlank()) {
            String exact = ownerMap.get(account.trim());
            if (exact != null) {
                return exact;
            }
            for (Map.Entry<String, String> entry : ownerMap.entrySet()) {
                if (AccountNumbers.sameAccount(account, entry.getKey())) {
                    return entry.getValue();
                }
            }
        }
        if (transaction.owner() != null && !transaction.owner().isBlank()) {
            return transaction.owner().trim();
        }
        return UNKNOWN_OWNER;
    }
}
