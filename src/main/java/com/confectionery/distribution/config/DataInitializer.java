package com.confectionery.distribution.config;

import com.confectionery.distribution.model.*;
import com.confectionery.distribution.repository.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.math.BigDecimal;

@Configuration
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    @Bean
    CommandLineRunner init(UserRepository userRepo,
            ProductRepository productRepo,
            StockBalanceRepository balanceRepo,
            ShopRepository shopRepo,
            DistributionProperties properties,
            PasswordEncoder encoder) {
        return args -> {
            // Bootstrap admin
            DistributionProperties.Admin adminProps = properties.getAdmin();
            if (!userRepo.existsByUsername(adminProps.getUsername())) {
                User admin = new User();
                admin.setUsername(adminProps.getUsername());
                admin.setPassword(encoder.encode(adminProps.getPassword()));
                admin.setRole(UserRole.ADMIN);
                admin.setFullName(adminProps.getFullName());
                userRepo.save(admin);
                log.info("Created admin account '{}'", admin.getUsername());
            }

            if (!properties.isSeedDemoData() || productRepo.count() > 0) {
                return;
            }

            User manager = new User();
            manager.setUsername("manager");
            manager.setPassword(encoder.encode("manager"));
            manager.setRole(UserRole.MANAGER);
            manager.setFullName("Demo Manager");
            manager = userRepo.save(manager);

            seedProduct(productRepo, balanceRepo, "Chocolate Bar", new BigDecimal("1.20"), 500);
            seedProduct(productRepo, balanceRepo, "Caramel Wafer", new BigDecimal("0.85"), 300);
            seedProduct(productRepo, balanceRepo, "Fruit Jelly", new BigDecimal("0.60"), 200);

            Shop shop = new Shop();
            shop.setName("Corner Store");
            shop.setAddress("1 Market Street");
            shop.setFridgeNumber("F-001");
            shop.setManager(manager);
            shopRepo.save(shop);

            log.info("Seeded demo data: manager '{}', {} products, shop '{}'", manager.getUsername(),
                    productRepo.count(), shop.getName());
        };
    }

    private static void seedProduct(ProductRepository productRepo, StockBalanceRepository balanceRepo,
            String name, BigDecimal price, int quantity) {
        Product product = new Product();
        product.setName(name);
        product.setPrice(price);
        product = productRepo.save(product);

        StockBalance pool = new StockBalance();
        pool.setProduct(product);
        pool.setQuantity(quantity);
        pool.setPrice(price);
        balanceRepo.save(pool);
    }
}
