package com.yanjiu.checkout.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.yanjiu.checkout.domain.Order;
import com.yanjiu.checkout.domain.TransitionFields;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface OrderMapper extends BaseMapper<Order> {

    /**
     * 订单状态条件更新（以状态作乐观锁）
     * 只有当前状态等于 expected 时才更新，单条语句保证原子性
     *
     * @param orderNo 商户订单号
     * @param expected 期望的当前状态取值
     * @param next 目标状态取值
     * @param fields 随状态一并写入的附加字段
     * @return 更新行数（0表示状态已被其他请求推进，1表示更新成功）
     */
    @Update("""
            <script>
            UPDATE pay_order
            SET status = #{next},
                <if test="fields.providerTradeNo != null">provider_trade_no = #{fields.providerTradeNo},</if>
                <if test="fields.providerStatusText != null">provider_status_text = #{fields.providerStatusText},</if>
                <if test="fields.payMethod != null">pay_method = #{fields.payMethodCode},</if>
                updated_at = CURRENT_TIMESTAMP
            WHERE order_no = #{orderNo}
              AND status = #{expected}
            </script>
            """)
    int updateStatusIfMatch(
            @Param("orderNo") String orderNo,
            @Param("expected") String expected,
            @Param("next") String next,
            @Param("fields") TransitionFields fields
    );
}
