package personal.hatchery.reservation.resource.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.hatchery.reservation.resource.application.port.in.GetResourceUseCase;
import personal.hatchery.reservation.resource.application.port.in.RegisterResourceCommand;
import personal.hatchery.reservation.resource.application.port.in.RegisterResourceUseCase;
import personal.hatchery.reservation.resource.application.port.in.UpdateResourceUseCase;
import personal.hatchery.reservation.resource.application.port.out.ResourceRepository;
import personal.hatchery.reservation.resource.domain.exception.DuplicateResourceException;
import personal.hatchery.reservation.resource.domain.exception.ResourceNotFoundException;
import personal.hatchery.reservation.resource.domain.model.Resource;
import personal.hatchery.reservation.resource.domain.model.ResourceKind;

import java.util.List;
import java.util.Optional;

/**
 * Resource Registry Service
 * 자원 등록/조회/속성 변경 UseCase 구현
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ResourceRegistryService implements RegisterResourceUseCase, GetResourceUseCase, UpdateResourceUseCase {

    private final ResourceRepository resourceRepository;

    @Override
    @Transactional
    public String register(RegisterResourceCommand command) {
        Resource resource = command.toResource();

        if (resourceRepository.existsById(resource.id())) {
            log.warn("Duplicate resource registration: resourceId={}", resource.id());
            throw new DuplicateResourceException(resource.id());
        }

        try {
            Resource saved = resourceRepository.insert(resource);
            log.info("Resource registered: resourceId={}, kind={}, capacity={}, certificationRequired={}",
                    saved.id(), saved.kind(), saved.capacity(), saved.certificationRequired());
            return saved.id();

        } catch (DataIntegrityViolationException e) {
            // existsById 이후 다른 요청이 먼저 등록한 경우 (PK 충돌)
            log.warn("Concurrent resource registration detected: resourceId={}", resource.id());
            throw new DuplicateResourceException(resource.id());
        }
    }

    @Override
    public Resource getResource(String resourceId) {
        return resourceRepository.findById(resourceId)
                .orElseThrow(() -> {
                    log.warn("Resource not found: resourceId={}", resourceId);
                    return new ResourceNotFoundException(resourceId);
                });
    }

    @Override
    public Optional<Resource> findResource(String resourceId) {
        return resourceRepository.findById(resourceId);
    }

    @Override
    public List<Resource> getResources(ResourceKind kind) {
        return kind == null ? resourceRepository.findAll() : resourceRepository.findAllByKind(kind);
    }

    @Override
    @Transactional
    public Resource updateCapacity(String resourceId, int capacity) {
        Resource updated = getResource(resourceId).withCapacity(capacity);
        Resource saved = resourceRepository.update(updated)
                .orElseThrow(() -> new ResourceNotFoundException(resourceId));

        log.info("Resource capacity updated: resourceId={}, capacity={}", resourceId, capacity);
        return saved;
    }

    @Override
    @Transactional
    public Resource setCertificationRequired(String resourceId, boolean required) {
        Resource current = getResource(resourceId);
        if (!current.isMachine() && required) {
            log.debug("Certification flag set on non-machine resource (ignored when booking): resourceId={}, kind={}",
                    resourceId, current.kind());
        }

        Resource saved = resourceRepository.update(current.withCertificationRequired(required))
                .orElseThrow(() -> new ResourceNotFoundException(resourceId));

        log.info("Resource certification requirement updated: resourceId={}, required={}", resourceId, required);
        return saved;
    }
}
