package com.studioflow.finance.config;

import com.studioflow.finance.model.Account;
import com.studioflow.finance.model.AccountType;
import com.studioflow.finance.repository.AccountRepository;
import com.studioflow.finance.service.SettingsService;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DataInitializer {

    @Bean
    CommandLineRunner init(AccountRepository accountRepo, SettingsService settingsService) {
        return args -> {
            // Default cash-in-hand account so ledger rows always have somewhere to land
            if (accountRepo.count() == 0) {
                Account cash = new Account();
                cash.setName("Cash");
                cash.setAccountType(AccountType.CASH);
                accountRepo.save(cash);
            }

            settingsService.ensureDefaults();
        };
    }
}
