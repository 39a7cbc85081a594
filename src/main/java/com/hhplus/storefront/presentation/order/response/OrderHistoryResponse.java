package com.hhplus.storefront.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 주문 내역 응답 DTO (최신순)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderHistoryResponse {

    @JsonProperty("user_id")
    private Long userId;

    private List<OrderResponse> orders;

    @JsonProperty("total_count")
    private Integer totalCount;
}
