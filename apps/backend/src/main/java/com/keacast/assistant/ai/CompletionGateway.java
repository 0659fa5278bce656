package com.keacast.assistant.ai;

import com.keacast.assistant.api.dto.CompletionRequest;
import com.keacast.assistant.api.dto.CompletionResponse;
import reactor.core.publisher.Mono;

public interface CompletionGateway {

    /**
     * 调用上游补全接口。可重试错误在内部按退避策略重试，
     * 重试耗尽或不可重试时以 {@link UpstreamException} 结束。
     * 上游返回没有可用 choice 时，返回 {@link CompletionResponse#empty()}。
     */
    Mono<CompletionResponse> complete(CompletionRequest request);
}
