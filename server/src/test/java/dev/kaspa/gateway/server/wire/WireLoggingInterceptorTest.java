package dev.kaspa.gateway.server.wire;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import dev.kaspa.gateway.rpc.protowire.GetBlockDagInfoRequestMessage;
import dev.kaspa.gateway.rpc.protowire.KaspadRequest;
import dev.kaspa.gateway.rpc.protowire.KaspadResponse;
import dev.kaspa.gateway.rpc.protowire.RPCGrpc;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.Metadata;
import io.grpc.Status;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WireLoggingInterceptorTest {

	@Mock
	private Channel channel;

	@Mock
	private ClientCall<KaspadRequest, KaspadResponse> delegate;

	@Mock
	private ClientCall.Listener<KaspadResponse> listener;

	@Test
	void forwardsTrafficUnchanged() {
		when(this.channel.newCall(eq(RPCGrpc.getMessageStreamMethod()), any(CallOptions.class)))
			.thenReturn(this.delegate);
		ClientCall<KaspadRequest, KaspadResponse> call = new WireLoggingInterceptor()
			.interceptCall(RPCGrpc.getMessageStreamMethod(), CallOptions.DEFAULT, this.channel);
		KaspadRequest request = KaspadRequest.newBuilder()
			.setId(9)
			.setGetBlockDagInfoRequest(GetBlockDagInfoRequestMessage.getDefaultInstance())
			.build();
		KaspadResponse response = KaspadResponse.newBuilder().setId(9).build();

		Metadata headers = new Metadata();
		call.start(this.listener, headers);
		call.sendMessage(request);

		@SuppressWarnings("unchecked")
		ArgumentCaptor<ClientCall.Listener<KaspadResponse>> wrapped = ArgumentCaptor.forClass(ClientCall.Listener.class);
		verify(this.delegate).start(wrapped.capture(), eq(headers));
		verify(this.delegate).sendMessage(request);
		wrapped.getValue().onMessage(response);
		wrapped.getValue().onClose(Status.OK, new Metadata());
		verify(this.listener).onMessage(response);
		verify(this.listener).onClose(eq(Status.OK), any(Metadata.class));
	}

}
