package com.dburyak.jsonrpc2;

import com.dburyak.jsonrpc2.err.InternalErrorException;
import com.dburyak.jsonrpc2.err.InvalidParamsException;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.subjects.MaybeSubject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class AsyncJsonRpcServerTest {
    private final Object ctx = new Object();

    /**
     * Counts invocations and never handles anything.
     */
    static class SkippingService implements AsyncService<Object> {
        final AtomicInteger calls = new AtomicInteger();

        @Override
        public Maybe<JsonRpcResponse> handle(JsonRpcRequest req, Object ctx) {
            calls.incrementAndGet();
            return Maybe.empty();
        }
    }

    static AsyncService<Object> hello() {
        return (req, ctx) -> Maybe.defer(() -> {
            if (!req.matches("hello")) {
                return Maybe.<JsonRpcResponse>empty();
            }
            var name = req.deserialize(String.class);
            return Maybe.just(JsonRpcResponse.success(req, "Hello, " + name + "!"));
        });
    }

    @Nested
    @DisplayName("Chain dispatch")
    class ChainDispatch {

        @Test
        @DisplayName("Should answer hello with the matching service")
        void hello() {
            var server = new AsyncJsonRpcServer<>(List.of(AsyncJsonRpcServerTest.hello()));

            var observer = server.serve(new JsonRpcRequest(7, "hello", "world"), ctx).test();

            observer.assertComplete();
            assertThat(observer.values()).hasSize(1);
            var resp = observer.values().get(0);
            assertThat(resp.getId()).isEqualTo(7);
            assertThat(resp.getResult()).isEqualTo("Hello, world!");
        }

        @Test
        @DisplayName("First responder wins and later services are never invoked")
        void firstMatchWins() {
            var before = new SkippingService();
            var after = new SkippingService();
            var server = new AsyncJsonRpcServer<>(List.of(before, AsyncJsonRpcServerTest.hello(), after));

            var observer = server.handle(new JsonRpcRequest(1, "hello", "world"), ctx).test();

            observer.assertValue(resp -> "Hello, world!".equals(resp.getResult()));
            assertThat(before.calls).hasValue(1);
            assertThat(after.calls).hasValue(0);
        }

        @Test
        @DisplayName("Next service waits until the suspended one completes empty")
        void sequential() {
            var pending = MaybeSubject.<JsonRpcResponse>create();
            var next = new SkippingService();
            AsyncService<Object> suspending = (req, c) -> pending;
            var server = new AsyncJsonRpcServer<>(List.of(suspending, next));

            var observer = server.handle(new JsonRpcRequest(2, "slow", null), ctx).test();

            observer.assertNotComplete();
            assertThat(next.calls).hasValue(0);

            pending.onComplete();

            assertThat(next.calls).hasValue(1);
            observer.assertValue(resp -> resp.getError().getCode() == -32601);
        }

        @Test
        @DisplayName("Suspended service that answers later wins")
        void suspendedAnswer() {
            var pending = MaybeSubject.<JsonRpcResponse>create();
            var next = new SkippingService();
            AsyncService<Object> suspending = (req, c) -> pending;
            var server = new AsyncJsonRpcServer<>(List.of(suspending, next));
            var req = new JsonRpcRequest(2, "slow", null);

            var observer = server.handle(req, ctx).test();
            pending.onSuccess(JsonRpcResponse.success(req, 42));

            observer.assertValue(resp -> Integer.valueOf(42).equals(resp.getResult()));
            assertThat(next.calls).hasValue(0);
        }

        @Test
        @DisplayName("Nothing is invoked until subscribed")
        void lazy() {
            var service = new SkippingService();
            var server = new AsyncJsonRpcServer<>(List.of(service));

            var single = server.handle(new JsonRpcRequest(1, "foo", null), ctx);
            assertThat(service.calls).hasValue(0);

            single.test().assertComplete();
            assertThat(service.calls).hasValue(1);
        }

        @Test
        @DisplayName("Blocking services can join the chain")
        void fromBlocking() {
            Service<Object> blocking = (req, c) -> req.matches("ping")
                    ? Optional.of(JsonRpcResponse.success(req, "pong"))
                    : Optional.empty();
            var server = new AsyncJsonRpcServer<>(List.of(AsyncService.fromBlocking(blocking)));

            server.handle(new JsonRpcRequest(1, "ping", null), ctx).test()
                    .assertValue(resp -> "pong".equals(resp.getResult()));
        }
    }

    @Nested
    @DisplayName("Method not found")
    class MethodNotFound {

        @Test
        @DisplayName("Should synthesize method not found when no service matches")
        void noMatch() {
            var server = new AsyncJsonRpcServer<>(List.of(new SkippingService(), AsyncJsonRpcServerTest.hello()));

            var observer = server.serve(new JsonRpcRequest(9, "missing", null), ctx).test();

            observer.assertValue(resp -> resp.getId().equals(9)
                    && resp.getError().equals(
                            new JsonRpcResponse.Error(-32601, "Service method not found: missing", null)));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Failure short-circuits the chain and becomes internal error with request id")
        void shortCircuit() {
            var after = new SkippingService();
            AsyncService<Object> failing = (req, c) -> Maybe.error(new IllegalStateException("Mock error"));
            var server = new AsyncJsonRpcServer<>(List.of(failing, after));

            var observer = server.serve(new JsonRpcRequest(3, "foo", null), ctx).test();

            observer.assertNoErrors();
            observer.assertValue(resp -> resp.getId().equals(3)
                    && resp.getError().equals(new JsonRpcResponse.Error(-32603, "Mock error", null)));
            assertThat(after.calls).hasValue(0);
        }

        @Test
        @DisplayName("Exception thrown from handle itself is an internal error")
        void thrownDirectly() {
            AsyncService<Object> throwing = (req, c) -> {
                throw new IllegalArgumentException("not even a Maybe");
            };
            var server = new AsyncJsonRpcServer<>(List.of(throwing));

            server.handle(new JsonRpcRequest(4, "foo", null), ctx).test()
                    .assertError(err -> err instanceof InternalErrorException
                            && "not even a Maybe".equals(err.getMessage())
                            && Integer.valueOf(4).equals(((InternalErrorException) err).getRequestId()));
        }

        @Test
        @DisplayName("Error thrown by a service is an internal error")
        void errorThrown() {
            AsyncService<Object> broken = (req, c) -> Maybe.defer(() -> {
                throw new AssertionError("invariant broken");
            });
            var server = new AsyncJsonRpcServer<>(List.of(broken));

            server.serve(new JsonRpcRequest(4, "foo", null), ctx).test()
                    .assertValue(resp -> resp.getId().equals(4)
                            && resp.getError().equals(new JsonRpcResponse.Error(-32603, "invariant broken", null)));
        }

        @Test
        @DisplayName("Null instead of a Maybe is an internal error")
        void nullMaybe() {
            AsyncService<Object> broken = (req, c) -> null;
            var server = new AsyncJsonRpcServer<>(List.of(broken));

            server.serve(new JsonRpcRequest(4, "foo", null), ctx).test()
                    .assertValue(resp -> resp.getError().getCode() == -32603);
        }

        @Test
        @DisplayName("Handle fails with the classified failure")
        void handleFailsClassified() {
            var server = new AsyncJsonRpcServer<>(List.of(AsyncJsonRpcServerTest.hello()));

            server.handle(new JsonRpcRequest(11, "hello", true), ctx).test()
                    .assertError(InvalidParamsException.class);
        }

        @Test
        @DisplayName("Params of wrong shape answer with invalid params and the request id")
        void invalidParams() {
            var server = new AsyncJsonRpcServer<>(List.of(AsyncJsonRpcServerTest.hello()));

            server.serve(new JsonRpcRequest(11, "hello", true), ctx).test()
                    .assertValue(resp -> resp.getId().equals(11) && resp.getError().getCode() == -32602);
        }
    }

    @Nested
    @DisplayName("Notifications")
    class Notifications {

        @Test
        @DisplayName("Successful notification gets no response")
        void successSuppressed() {
            var server = new AsyncJsonRpcServer<>(List.of(AsyncJsonRpcServerTest.hello()));

            server.serve(JsonRpcRequest.newNotification("hello", "world"), ctx).test()
                    .assertComplete()
                    .assertNoValues();
        }

        @Test
        @DisplayName("Failed notification gets an error response with null id")
        void failureSurfaced() {
            AsyncService<Object> failing = (req, c) -> Maybe.error(new IllegalStateException("Mock error"));
            var server = new AsyncJsonRpcServer<>(List.of(failing));

            server.serve(JsonRpcRequest.newNotification("foo", null), ctx).test()
                    .assertValue(resp -> resp.getId() == null && !resp.isSuccess());
        }

        @Test
        @DisplayName("Never-respond policy drops failed notifications too")
        void neverRespond() {
            AsyncService<Object> failing = (req, c) -> Maybe.error(new IllegalStateException("Mock error"));
            var server = new AsyncJsonRpcServer<>(List.of(failing), NotificationPolicy.NEVER_RESPOND);

            server.serve(JsonRpcRequest.newNotification("foo", null), ctx).test()
                    .assertComplete()
                    .assertNoValues();
        }
    }

    @Test
    @DisplayName("Closing the server closes services in order")
    void closeAsync() {
        var closed = new ArrayList<String>();
        var server = new AsyncJsonRpcServer<>(List.of(closeable("first", closed), closeable("second", closed)));

        server.closeAsync().test().assertComplete();

        assertThat(closed).containsExactly("first", "second");
    }

    private static AsyncService<Object> closeable(String name, List<String> closed) {
        return new AsyncService<>() {
            @Override
            public Maybe<JsonRpcResponse> handle(JsonRpcRequest req, Object ctx) {
                return Maybe.empty();
            }

            @Override
            public Completable closeAsync() {
                return Completable.fromAction(() -> closed.add(name));
            }
        };
    }
}
