/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.queue.grpc;

import com.geastalt.queue.grpc.generated.InspectQueueRequest;
import com.geastalt.queue.grpc.generated.InspectQueueResponse;
import com.geastalt.queue.grpc.generated.InvokeRequest;
import com.geastalt.queue.grpc.generated.InvokeResponse;
import com.geastalt.queue.grpc.generated.PartitionInfo;
import com.geastalt.queue.grpc.generated.QueueServiceGrpc;
import com.geastalt.queue.model.ArrivalRequest;
import com.geastalt.queue.model.QueueMode;
import com.geastalt.queue.model.QueueStatus;
import com.geastalt.queue.model.ReleaseSignal;
import com.geastalt.queue.service.QueueService;
import io.grpc.stub.StreamObserver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.devh.boot.grpc.server.service.GrpcService;

import java.util.ArrayList;
import java.util.List;

/**
 * gRPC service implementation for queue invocations and inspection.
 */
@Slf4j
@GrpcService
@RequiredArgsConstructor
public class QueueGrpcService extends QueueServiceGrpc.QueueServiceImplBase {

    private final QueueService queueService;
    private final PayloadCodec payloadCodec;

    @Override
    public void invoke(InvokeRequest request, StreamObserver<InvokeResponse> responseObserver) {
        log.debug("gRPC Invoke: stateId={}, mode={}, arrivals={}, signals={}",
                request.getStateId(), request.getMode(), request.getArrivalsCount(), request.getSignalsCount());

        List<ArrivalRequest> arrivals = new ArrayList<>();
        List<ReleaseSignal> signals = new ArrayList<>();
        try {
            for (var arrival : request.getArrivalsList()) {
                arrivals.add(new ArrivalRequest(arrival.getKey(), payloadCodec.decode(arrival.getPayloadJson())));
            }
            for (var signal : request.getSignalsList()) {
                signals.add(ReleaseSignal.fromRecord(payloadCodec.decode(signal.getPayloadJson())));
            }
        } catch (IllegalArgumentException e) {
            log.warn("Rejected invoke for state {}: {}", request.getStateId(), e.getMessage());
            responseObserver.onNext(InvokeResponse.newBuilder()
                    .setSuccess(false)
                    .setStatus(com.geastalt.queue.grpc.generated.QueueStatus.QUEUE_STATUS_INVALID_REQUEST)
                    .setErrorMessage(e.getMessage())
                    .build());
            responseObserver.onCompleted();
            return;
        }

        var result = queueService.invoke(request.getStateId(), mapMode(request.getMode()), arrivals, signals);

        var responseBuilder = InvokeResponse.newBuilder();
        if (result.isSuccess()) {
            responseBuilder
                    .setSuccess(true)
                    .setStatus(com.geastalt.queue.grpc.generated.QueueStatus.QUEUE_STATUS_OK);
            result.getValue().admissions()
                    .forEach(payload -> responseBuilder.addAdmittedPayloadJson(payloadCodec.encode(payload)));
        } else {
            var queueError = result.getError();
            responseBuilder
                    .setSuccess(false)
                    .setErrorMessage(queueError.message())
                    .setStatus(mapStatus(queueError.status()));
        }

        responseObserver.onNext(responseBuilder.build());
        responseObserver.onCompleted();
    }

    @Override
    public void inspectQueue(InspectQueueRequest request, StreamObserver<InspectQueueResponse> responseObserver) {
        log.debug("gRPC InspectQueue: stateId={}", request.getStateId());

        var result = queueService.inspect(request.getStateId());

        var responseBuilder = InspectQueueResponse.newBuilder();
        if (result.isSuccess()) {
            responseBuilder.setStatus(com.geastalt.queue.grpc.generated.QueueStatus.QUEUE_STATUS_OK);
            for (var partition : result.getValue().partitions()) {
                responseBuilder.addPartitions(PartitionInfo.newBuilder()
                        .setPartition(partition.partition())
                        .setLocked(partition.locked())
                        .setDepth(partition.depth())
                        .setHeadKey(partition.headKey() != null ? partition.headKey() : "")
                        .build());
            }
        } else {
            responseBuilder
                    .setStatus(mapStatus(result.getError().status()))
                    .setErrorMessage(result.getError().message());
        }

        responseObserver.onNext(responseBuilder.build());
        responseObserver.onCompleted();
    }

    private QueueMode mapMode(com.geastalt.queue.grpc.generated.QueueMode mode) {
        return switch (mode) {
            case QUEUE_MODE_SINGLE -> QueueMode.SINGLE;
            case QUEUE_MODE_MULTI -> QueueMode.MULTI;
            // unspecified falls back to the configured default
            case QUEUE_MODE_UNSPECIFIED, UNRECOGNIZED -> null;
        };
    }

    private com.geastalt.queue.grpc.generated.QueueStatus mapStatus(QueueStatus status) {
        return switch (status) {
            case OK -> com.geastalt.queue.grpc.generated.QueueStatus.QUEUE_STATUS_OK;
            case INVALID_REQUEST -> com.geastalt.queue.grpc.generated.QueueStatus.QUEUE_STATUS_INVALID_REQUEST;
            case INVALID_STATE -> com.geastalt.queue.grpc.generated.QueueStatus.QUEUE_STATUS_INVALID_STATE;
            case STORE_ERROR -> com.geastalt.queue.grpc.generated.QueueStatus.QUEUE_STATUS_STORE_ERROR;
            case TIMEOUT -> com.geastalt.queue.grpc.generated.QueueStatus.QUEUE_STATUS_TIMEOUT;
            case ERROR -> com.geastalt.queue.grpc.generated.QueueStatus.QUEUE_STATUS_ERROR;
        };
    }
}
