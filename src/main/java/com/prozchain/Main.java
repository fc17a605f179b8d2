package com.prozchain;

import com.prozchain.block.Block;
import com.prozchain.config.CommonConfig;
import com.prozchain.config.ConsensusConfig;
import com.prozchain.consensus.ConsensusCore;
import com.prozchain.leader.coordinator.SlotCoordinator;
import com.prozchain.storage.crypto.ValidatorKeyStore;
import com.prozchain.treasury.InMemoryStakeTreasury;
import com.prozchain.treasury.StakeTreasury;
import com.prozchain.types.Hash256;
import com.prozchain.validator.ValidatorId;
import com.prozchain.validator.ValidatorRegistry;
import lombok.extern.java.Log;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;

/**
 * Starts a single validator development node that produces and finalizes blocks on its own.
 */
@Log
public class Main {

    public static void main(String[] args) {
        configureLogging();

        AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext(CommonConfig.class);
        context.registerShutdownHook();

        ConsensusConfig config = context.getBean(ConsensusConfig.class);
        ValidatorKeyStore keyStore = context.getBean(ValidatorKeyStore.class);
        ValidatorRegistry registry = context.getBean(ValidatorRegistry.class);
        StakeTreasury treasury = context.getBean(StakeTreasury.class);

        ValidatorId local = keyStore.getLocalValidator().orElseGet(keyStore::generate);
        if (treasury instanceof InMemoryStakeTreasury inMemoryTreasury) {
            inMemoryTreasury.deposit(local, config.getMinStake());
        }
        registry.register(local);

        ConsensusCore consensusCore = context.getBean(ConsensusCore.class);
        consensusCore.start(Block.genesis(Hash256.empty(), local));

        SlotCoordinator slotCoordinator = context.getBean(SlotCoordinator.class);
        slotCoordinator.addListener(consensusCore);
        slotCoordinator.start();

        log.log(Level.INFO, "Development node running as validator " + local + " (" + local.getAddress() + ")");
    }

    private static void configureLogging() {
        try (InputStream config = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            log.log(Level.WARNING, "Could not load logging.properties, using JVM defaults", e);
        }
    }
}
