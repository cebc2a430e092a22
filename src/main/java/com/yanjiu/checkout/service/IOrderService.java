package com.yanjiu.checkout.service;

import com.yanjiu.checkout.domain.Order;
import com.yanjiu.checkout.domain.OrderStatus;
import com.yanjiu.checkout.domain.TransitionFields;
import com.yanjiu.checkout.exception.DuplicateOrderNoException;

import java.util.Optional;

/**
 * 订单存储接口
 *
 * 实现要求：
 * 1. orderNo 全局唯一，重复插入必须失败而不是覆盖
 * 2. 状态只能通过 compareAndTransition 修改，不允许整行更新
 * 3. compareAndTransition 必须是单条条件更新语句，防止并发回调或并发分析造成丢失更新
 *
 * 不继承 IService，调用方拿不到 updateById、saveOrUpdate、removeById 等整行写方法
 */
public interface IOrderService {

    /**
     * 插入新订单
     *
     * @param order 订单对象
     * @throws DuplicateOrderNoException orderNo 已存在
     */
    void insertOrder(Order order);

    /**
     * 根据商户订单号查询订单
     *
     * @param orderNo 商户订单号
     * @return 订单，不存在时为空
     */
    Optional<Order> getByOrderNo(String orderNo);

    /**
     * 条件状态流转：仅当当前状态等于 expected 时，原子地更新为 next 并写入附加字段
     *
     * @param orderNo 商户订单号
     * @param expected 期望的当前状态
     * @param next 目标状态，必须是 expected 的下一个状态
     * @param fields 附加字段，为null的字段不更新
     * @return true: 本次请求完成了流转；false: 状态不匹配（已被其他请求推进或订单不存在）
     * @throws IllegalArgumentException 流转跳跃或回退
     * @throws org.springframework.dao.DataAccessException 存储异常
     */
    boolean compareAndTransition(String orderNo, OrderStatus expected, OrderStatus next, TransitionFields fields);
}
