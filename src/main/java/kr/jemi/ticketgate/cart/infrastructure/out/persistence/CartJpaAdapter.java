package kr.jemi.ticketgate.cart.infrastructure.out.persistence;

import kr.jemi.ticketgate.cart.application.port.out.CartPort;
import kr.jemi.ticketgate.cart.domain.Cart;
import kr.jemi.ticketgate.cart.domain.CartItem;
import kr.jemi.ticketgate.cart.domain.CartStatus;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class CartJpaAdapter implements CartPort {

    private final CartJpaRepository cartJpaRepository;
    private final CartItemJpaRepository cartItemJpaRepository;

    public CartJpaAdapter(CartJpaRepository cartJpaRepository, CartItemJpaRepository cartItemJpaRepository) {
        this.cartJpaRepository = cartJpaRepository;
        this.cartItemJpaRepository = cartItemJpaRepository;
    }

    @Override
    public Cart insert(Cart cart) {
        cartJpaRepository.saveAndFlush(CartJpaEntity.fromDomain(cart));
        return cart;
    }

    @Override
    public Cart save(Cart cart) {
        cartJpaRepository.save(CartJpaEntity.fromDomain(cart));

        Set<Long> keptIds = cart.getItems().stream().map(CartItem::getId).collect(Collectors.toSet());
        List<CartItemJpaEntity> removed = cartItemJpaRepository.findByCartIdOrderByAddedAtAsc(cart.getId()).stream()
                .filter(item -> !keptIds.contains(item.getId()))
                .toList();
        cartItemJpaRepository.deleteAll(removed);
        cartItemJpaRepository.saveAll(cart.getItems().stream()
                .map(item -> CartItemJpaEntity.fromDomain(cart.getId(), item))
                .toList());
        cartJpaRepository.flush();
        return cart;
    }

    @Override
    public Optional<Cart> findById(long cartId) {
        return cartJpaRepository.findById(cartId).map(this::toDomain);
    }

    @Override
    public Optional<Cart> findByIdForUpdate(long cartId) {
        return cartJpaRepository.findByIdForUpdate(cartId).map(this::toDomain);
    }

    @Override
    public Optional<Cart> findActive(long userId, long eventId) {
        return cartJpaRepository.findByUserIdAndEventIdAndActive(userId, eventId, 1).map(this::toDomain);
    }

    @Override
    public Optional<Cart> findActiveForUpdate(long userId, long eventId) {
        return cartJpaRepository.findActiveForUpdate(userId, eventId).map(this::toDomain);
    }

    @Override
    public List<Long> findExpiredActiveIds(LocalDateTime now, int limit) {
        return cartJpaRepository.findExpiredIds(CartStatus.ACTIVE, now, PageRequest.of(0, limit));
    }

    private Cart toDomain(CartJpaEntity entity) {
        List<CartItem> items = cartItemJpaRepository.findByCartIdOrderByAddedAtAsc(entity.getId()).stream()
                .map(CartItemJpaEntity::toDomain)
                .toList();
        return entity.toDomain(items);
    }
}
