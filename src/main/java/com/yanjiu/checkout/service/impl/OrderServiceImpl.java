package com.yanjiu.checkout.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.yanjiu.checkout.domain.Order;
import com.yanjiu.checkout.domain.OrderStatus;
import com.yanjiu.checkout.domain.TransitionFields;
import com.yanjiu.checkout.exception.DuplicateOrderNoException;
import com.yanjiu.checkout.mapper.OrderMapper;
import com.yanjiu.checkout.service.IOrderService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
public class OrderServiceImpl extends ServiceImpl<OrderMapper, Order> implements IOrderService {

    private final OrderMapper orderMapper;

    public OrderServiceImpl(OrderMapper orderMapper) {
        this.orderMapper = orderMapper;
    }

    @Override
    public void insertOrder(Order order) {
        try {
            orderMapper.insert(order);
        } catch (DuplicateKeyException e) {
            throw new DuplicateOrderNoException(order.getOrderNo(), e);
        }
    }

    @Override
    public Optional<Order> getByOrderNo(String orderNo) {
        LambdaQueryWrapper<Order> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(Order::getOrderNo, orderNo);
        return Optional.ofNullable(orderMapper.selectOne(queryWrapper));
    }

    @Override
    public boolean compareAndTransition(String orderNo, OrderStatus expected, OrderStatus next,
                                        TransitionFields fields) {
        if (expected == null || !expected.canTransitTo(next)) {
            throw new IllegalArgumentException("不允许的状态流转: " + expected + " -> " + next);
        }

        int updatedRows = orderMapper.updateStatusIfMatch(
                orderNo,
                expected.getCode(),
                next.getCode(),
                fields == null ? TransitionFields.NONE : fields
        );

        if (updatedRows == 0) {
            log.debug("[状态流转未生效] orderNo={}, expected={}, next={}", orderNo, expected, next);
            return false;
        }
        log.debug("[状态流转成功] orderNo={}, {} -> {}", orderNo, expected, next);
        return true;
    }
}
