package com.tradeerp.invoicing.controller;

import com.tradeerp.invoicing.service.SettingsService;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/settings/ledger-accounts")
public class LedgerSettingsController {

    private final SettingsService settingsService;

    public LedgerSettingsController(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @GetMapping
    public Map<String, Long> accounts() {
        Map<String, Long> accounts = new LinkedHashMap<>();
        accounts.put("sales", settingsService.getSalesAccountId());
        accounts.put("purchase", settingsService.getPurchaseAccountId());
        accounts.put("cash", settingsService.getCashAccountId());
        return accounts;
    }

    @PutMapping
    public Map<String, Long> update(@RequestBody Map<String, Long> accounts) {
        if (accounts.containsKey("sales"))
            settingsService.updateAccountSetting(SettingsService.KEY_SALES_ACCOUNT, accounts.get("sales"));
        if (accounts.containsKey("purchase"))
            settingsService.updateAccountSetting(SettingsService.KEY_PURCHASE_ACCOUNT, accounts.get("purchase"));
        if (accounts.containsKey("cash"))
            settingsService.updateAccountSetting(SettingsService.KEY_CASH_ACCOUNT, accounts.get("cash"));
        return accounts();
    }
}
