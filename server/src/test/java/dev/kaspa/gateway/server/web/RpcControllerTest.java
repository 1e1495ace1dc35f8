package dev.kaspa.gateway.server.web;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import dev.kaspa.gateway.rpc.GatewayErrorKind;
import dev.kaspa.gateway.rpc.GatewayException;
import dev.kaspa.gateway.rpc.KaspaNodeClient;
import dev.kaspa.gateway.rpc.protowire.GetBlockDagInfoResponseMessage;
import dev.kaspa.gateway.rpc.protowire.GetBlockResponseMessage;
import dev.kaspa.gateway.rpc.protowire.GetUtxosByAddressesResponseMessage;
import dev.kaspa.gateway.rpc.protowire.RpcBlock;
import dev.kaspa.gateway.rpc.protowire.RpcBlockHeader;
import dev.kaspa.gateway.rpc.protowire.RpcTransaction;
import dev.kaspa.gateway.rpc.protowire.RpcUtxosByAddressesEntry;
import dev.kaspa.gateway.rpc.protowire.SubmitTransactionResponseMessage;
import dev.kaspa.gateway.server.model.BlockResponse;
import dev.kaspa.gateway.server.model.DagTipsResponse;
import dev.kaspa.gateway.server.model.GetBlockRequest;
import dev.kaspa.gateway.server.model.GetUtxosByAddressesRequest;
import dev.kaspa.gateway.server.model.RpcResponse;
import dev.kaspa.gateway.server.model.SubmitTransactionRequest;
import dev.kaspa.gateway.server.model.SubmitTransactionResponse;
import dev.kaspa.gateway.server.model.TransactionInput;
import dev.kaspa.gateway.server.model.UtxosByAddressesResponse;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RpcControllerTest {

	private static final String HASH = "9a".repeat(32);

	@Mock
	private KaspaNodeClient nodeClient;

	@Test
	void shortHashIsRejectedBeforeContactingNode() {
		RpcController controller = new RpcController(this.nodeClient);

		GatewayException error = assertThrows(GatewayException.class,
				() -> controller.getBlock(new GetBlockRequest("short", true)));

		assertEquals(GatewayErrorKind.INVALID_ARGUMENT, error.kind());
		assertEquals("Invalid block hash format", error.getMessage());
		verifyNoInteractions(this.nodeClient);
	}

	@Test
	void nonHexHashIsRejected() {
		RpcController controller = new RpcController(this.nodeClient);

		assertThrows(GatewayException.class, () -> controller.getBlock(new GetBlockRequest("zz".repeat(32), true)));
		assertThrows(GatewayException.class, () -> controller.getBlock(new GetBlockRequest(null, true)));
		verifyNoInteractions(this.nodeClient);
	}

	@Test
	void getBlockDefaultsToIncludingTransactions() {
		when(this.nodeClient.getBlock(HASH, true)).thenReturn(Mono.just(GetBlockResponseMessage.newBuilder()
			.setBlock(RpcBlock.newBuilder().setHeader(RpcBlockHeader.newBuilder().setHash(HASH).setDaaScore(99)))
			.build()));
		RpcController controller = new RpcController(this.nodeClient);

		RpcResponse<BlockResponse> response = controller.getBlock(new GetBlockRequest(HASH, null))
			.block(Duration.ofSeconds(5));

		assertTrue(response.success());
		assertNull(response.error());
		assertEquals(HASH, response.data().hash());
		assertEquals(99L, response.data().header().daaScore());
		assertTrue(response.latencyMs() >= 0);
	}

	@Test
	void nodeFailuresPropagateUnchanged() {
		GatewayException remote = new GatewayException(GatewayErrorKind.REMOTE, "block not found");
		when(this.nodeClient.getBlock(HASH, false)).thenReturn(Mono.error(remote));
		RpcController controller = new RpcController(this.nodeClient);

		StepVerifier.create(controller.getBlock(new GetBlockRequest(HASH, false)))
			.expectErrorMatches(error -> error == remote)
			.verify(Duration.ofSeconds(5));
	}

	@Test
	void submitTransactionDefaultsOrphanFlagToFalse() {
		when(this.nodeClient.submitTransaction(any(RpcTransaction.class), eq(false))).thenReturn(Mono
			.just(SubmitTransactionResponseMessage.newBuilder().setTransactionId("cd".repeat(32)).build()));
		RpcController controller = new RpcController(this.nodeClient);
		TransactionInput transaction = new TransactionInput(0, List.of(), List.of(), null, null, null, null);

		RpcResponse<SubmitTransactionResponse> response = controller
			.submitTransaction(new SubmitTransactionRequest(transaction, null))
			.block(Duration.ofSeconds(5));

		assertEquals("cd".repeat(32), response.data().transactionId());
		verify(this.nodeClient).submitTransaction(RpcTransaction.getDefaultInstance(), false);
	}

	@Test
	void dagTipsAreConverted() {
		when(this.nodeClient.getBlockDagInfo()).thenReturn(Mono.just(GetBlockDagInfoResponseMessage.newBuilder()
			.setNetworkName("kaspa-mainnet")
			.addTipHashes("01".repeat(32))
			.setBlockCount(1_000)
			.setHeaderCount(1_001)
			.setDifficulty(2.5)
			.setPastMedianTime(1_700_000_000_000L)
			.addVirtualParentHashes("02".repeat(32))
			.setPruningPointHash("03".repeat(32))
			.setVirtualDaaScore(77)
			.build()));
		RpcController controller = new RpcController(this.nodeClient);

		DagTipsResponse tips = controller.getDagTips().block(Duration.ofSeconds(5)).data();

		assertEquals("kaspa-mainnet", tips.networkName());
		assertEquals(List.of("01".repeat(32)), tips.tipHashes());
		assertEquals(1_000L, tips.blockCount());
		assertEquals(1_001L, tips.headerCount());
		assertEquals(2.5, tips.difficulty());
		assertEquals(1_700_000_000_000L, tips.pastMedianTime());
		assertEquals(List.of("02".repeat(32)), tips.virtualParentHashes());
		assertEquals("03".repeat(32), tips.pruningPointHash());
		assertEquals(77L, tips.virtualDaaScore());
	}

	@Test
	void utxoLookupTrimsAddressesAndRejectsEmptyList() {
		when(this.nodeClient.getUtxosByAddresses(List.of("kaspa:qpone"))).thenReturn(Mono.just(
				GetUtxosByAddressesResponseMessage.newBuilder()
					.addEntries(RpcUtxosByAddressesEntry.newBuilder().setAddress("kaspa:qpone"))
					.build()));
		RpcController controller = new RpcController(this.nodeClient);

		UtxosByAddressesResponse utxos = controller
			.getUtxosByAddresses(new GetUtxosByAddressesRequest(Arrays.asList(" kaspa:qpone ", null, "")))
			.block(Duration.ofSeconds(5))
			.data();

		assertEquals("kaspa:qpone", utxos.entries().get(0).get("address"));
		assertThrows(GatewayException.class,
				() -> controller.getUtxosByAddresses(new GetUtxosByAddressesRequest(List.of(" "))));
	}

}
