package com.prozchain.checkpoint;

import com.prozchain.block.Block;
import com.prozchain.config.ConsensusConfig;
import com.prozchain.exception.checkpoint.CheckpointMonotonicityException;
import com.prozchain.exception.crypto.InvalidSignatureException;
import com.prozchain.exception.validator.UnknownValidatorException;
import com.prozchain.finality.FinalityGadget;
import com.prozchain.finality.FinalityJustification;
import com.prozchain.forkchoice.ForkChoiceService;
import com.prozchain.network.PeerMessageCoordinator;
import com.prozchain.storage.FinalizedBlockStore;
import com.prozchain.storage.InMemoryRepository;
import com.prozchain.storage.crypto.ValidatorKeyStore;
import com.prozchain.treasury.InMemoryStakeTreasury;
import com.prozchain.utils.TestUtils;
import com.prozchain.validator.ValidatorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class CheckpointSystemTest {

    private static final Instant NOW = Instant.ofEpochSecond(1_000_000);

    @Mock
    private PeerMessageCoordinator messageCoordinator;

    private final List<TestUtils.Signer> signers = TestUtils.signers(4);
    private final TestUtils.Signer local = signers.get(0);
    private final Block genesis = TestUtils.genesis(local.getId());

    private InMemoryRepository repository;
    private ConsensusConfig config;
    private ValidatorRegistry registry;
    private ForkChoiceService forkChoice;
    private FinalityGadget gadget;
    private ValidatorKeyStore keyStore;
    private CheckpointSystem checkpointSystem;
    private List<Block> chain;

    @BeforeEach
    void setup() {
        config = ConsensusConfig.builder().checkpointInterval(5).build();
        repository = new InMemoryRepository();
        registry = TestUtils.registry(config, new InMemoryStakeTreasury(), signers, 2000);
        forkChoice = new ForkChoiceService(config, registry);
        forkChoice.initialize(genesis);
        gadget = new FinalityGadget(config, registry, forkChoice, new FinalizedBlockStore(repository));
        gadget.initialize(genesis);

        keyStore = new ValidatorKeyStore(repository);
        keyStore.put(local.getId().getPublicKey().getBytes(), local.getPrivateKey());

        checkpointSystem = new CheckpointSystem(config, registry, gadget, forkChoice, repository,
                messageCoordinator, keyStore);

        chain = TestUtils.chain(genesis, 10, local.getId(), "");
        chain.forEach(block -> forkChoice.onBlock(block, NOW));
    }

    private Block at(long height) {
        return chain.get((int) height - 1);
    }

    @Test
    void onlyMultiplesOfIntervalAreCheckpointHeights() {
        assertTrue(checkpointSystem.isCheckpointHeight(5));
        assertTrue(checkpointSystem.isCheckpointHeight(10));
        assertFalse(checkpointSystem.isCheckpointHeight(0));
        assertFalse(checkpointSystem.isCheckpointHeight(7));

        assertEquals(Optional.empty(), checkpointSystem.onBlock(at(3)));
        verifyNoInteractions(messageCoordinator);
    }

    @Test
    void localValidatorSignsOncePerHeight() {
        checkpointSystem.onBlock(at(5));
        checkpointSystem.onBlock(at(5));

        ArgumentCaptor<CheckpointSignature> captor = ArgumentCaptor.forClass(CheckpointSignature.class);
        verify(messageCoordinator, times(1)).broadcastCheckpointSignature(captor.capture());
        CheckpointSignature signature = captor.getValue();
        assertEquals(local.getId(), signature.getValidator());
        assertEquals(at(5).getHash(), signature.getBlockHash());
        assertTrue(signature.isSignatureValid());
    }

    @Test
    void supermajorityOfSignaturesSealsAndFinalizes() {
        assertTrue(checkpointSystem.onBlock(at(5)).isEmpty());
        assertTrue(checkpointSystem.onSignature(signers.get(1).checkpoint(at(5))).isEmpty());

        Checkpoint checkpoint = checkpointSystem.onSignature(signers.get(2).checkpoint(at(5))).orElseThrow();

        assertEquals(5, checkpoint.getHeight());
        assertEquals(at(5).getHash(), checkpoint.getBlockHash());
        assertEquals(3, checkpoint.getSignatures().size());
        assertEquals(BigInteger.valueOf(6000), checkpoint.getSignedPower());
        assertEquals(Optional.of(checkpoint), checkpointSystem.getLatest());
        assertEquals(at(5), gadget.getLastFinalized());
        assertEquals(5L, (long) forkChoice.getCheckpoint().getValue1());

        // late signatures return the sealed checkpoint
        assertEquals(Optional.of(checkpoint), checkpointSystem.onSignature(signers.get(3).checkpoint(at(5))));
    }

    @Test
    void signaturesWithoutTheBlockDoNotSeal() {
        checkpointSystem.onSignature(signers.get(1).checkpoint(at(5)));
        checkpointSystem.onSignature(signers.get(2).checkpoint(at(5)));
        checkpointSystem.onSignature(signers.get(3).checkpoint(at(5)));

        assertTrue(checkpointSystem.getLatest().isEmpty());

        // the block supplies the missing state root
        assertTrue(checkpointSystem.onBlock(at(5)).isPresent());
    }

    @Test
    void forgedSignatureIsRejected() {
        CheckpointSignature genuine = signers.get(2).checkpoint(at(5));
        CheckpointSignature forged = new CheckpointSignature(signers.get(1).getId(), 5, at(5).getHash(),
                genuine.getSignature());

        assertThrows(InvalidSignatureException.class, () -> checkpointSystem.onSignature(forged));
    }

    @Test
    void signatureFromOutsideTheSetIsRejected() {
        TestUtils.Signer outsider = new TestUtils.Signer();

        assertThrows(UnknownValidatorException.class,
                () -> checkpointSystem.onSignature(outsider.checkpoint(at(5))));
    }

    @Test
    void sealedCheckpointsOnlyMoveForward() {
        Checkpoint ten = checkpoint(at(10));
        checkpointSystem.seal(ten);
        assertEquals(at(10), gadget.getLastFinalized());
        assertEquals(FinalityJustification.CHECKPOINT,
                new FinalizedBlockStore(repository).getRecord(10).orElseThrow().getJustification());

        assertEquals(ten, checkpointSystem.seal(ten));
        assertThrows(CheckpointMonotonicityException.class, () -> checkpointSystem.seal(checkpoint(at(5))));

        Block other = TestUtils.child(at(9), signers.get(1).getId(), "other");
        assertThrows(CheckpointMonotonicityException.class, () -> checkpointSystem.seal(checkpoint(other)));
    }

    @Test
    void latestCheckpointSurvivesRestart() {
        checkpointSystem.seal(checkpoint(at(5)));

        CheckpointSystem restored = new CheckpointSystem(config, registry, gadget, forkChoice, repository,
                messageCoordinator, keyStore);
        restored.initializeFromDatabase();

        assertEquals(5, restored.getLatest().orElseThrow().getHeight());
        assertEquals(List.of(5L), restored.getSealedHeights());
        assertEquals(Optional.of(local.getId()), keyStore.getLocalValidator());
    }

    @Test
    void nodeWithoutKeyDoesNotSign() {
        InMemoryRepository emptyRepository = new InMemoryRepository();
        CheckpointSystem observer = new CheckpointSystem(config, registry, gadget, forkChoice, emptyRepository,
                messageCoordinator, new ValidatorKeyStore(emptyRepository));

        observer.onBlock(at(5));

        verify(messageCoordinator, times(0)).broadcastCheckpointSignature(any());
    }

    private Checkpoint checkpoint(Block block) {
        List<CheckpointSignature> signatures = signers.stream()
                .map(signer -> signer.checkpoint(block))
                .toList();
        return new Checkpoint(block.getHeight(), block.getHash(), block.getHeader().getStateRoot(), signatures,
                BigInteger.valueOf(8000), BigInteger.valueOf(8000));
    }
}
