package dev.kaspa.gateway.server.wire;

import java.util.concurrent.atomic.AtomicLong;

import dev.kaspa.gateway.rpc.protowire.KaspadRequest;
import dev.kaspa.gateway.rpc.protowire.KaspadResponse;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.ForwardingClientCall;
import io.grpc.ForwardingClientCallListener;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.Status;

/**
 * gRPC interceptor that reports every envelope crossing the node channel through {@link Wire}.
 * Each intercepted call gets a short sequential stream id so lines of one stream can be grouped.
 */
public class WireLoggingInterceptor implements ClientInterceptor {

	private final AtomicLong streams = new AtomicLong();

	@Override
	public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(MethodDescriptor<ReqT, RespT> method,
			CallOptions callOptions, Channel next) {
		String streamId = "s" + this.streams.incrementAndGet();
		return new ForwardingClientCall.SimpleForwardingClientCall<>(next.newCall(method, callOptions)) {

			@Override
			public void start(Listener<RespT> responseListener, Metadata headers) {
				super.start(new ForwardingClientCallListener.SimpleForwardingClientCallListener<>(responseListener) {

					@Override
					public void onMessage(RespT message) {
						if (message instanceof KaspadResponse response) {
							Wire.rx(streamId, response);
						}
						super.onMessage(message);
					}

					@Override
					public void onClose(Status status, Metadata trailers) {
						Wire.closed(streamId, status.getCode().name());
						super.onClose(status, trailers);
					}

				}, headers);
			}

			@Override
			public void sendMessage(ReqT message) {
				if (message instanceof KaspadRequest request) {
					Wire.tx(streamId, request);
				}
				super.sendMessage(message);
			}

		};
	}

}
