package com.yanjiu.checkout.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 支付订单实体类（每次下单一行）
 *
 * 订单状态流转：
 * - PENDING: 已创建，等待支付
 * - PAID: 回调确认已支付，等待分析
 * - ANALYZED: 分析额度已消费
 *
 * orderNo 与 amount 创建后不可修改；状态只能通过条件更新推进
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@TableName("pay_order")
public class Order {

    /**
     * 主键ID
     */
    @TableId(type = IdType.ASSIGN_ID)
    private Long id;

    /**
     * 商户订单号（业务唯一标识，对应平台的 out_trade_no）
     */
    private String orderNo;

    /**
     * 支付平台订单号（回调确认后填充，对应平台的 trade_no）
     */
    private String providerTradeNo;

    /**
     * 客户端标识（前端生成，不做鉴权）
     */
    private String clientId;

    /**
     * 订单金额
     */
    private BigDecimal amount;

    /**
     * 支付方式
     */
    private PayMethod payMethod;

    /**
     * 平台回传的原始交易状态（如 TRADE_SUCCESS）
     */
    private String providerStatusText;

    /**
     * 订单状态
     */
    private OrderStatus status;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
