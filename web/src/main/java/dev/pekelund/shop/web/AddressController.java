package dev.pekelund.shop.web;

import dev.pekelund.shop.address.AddressService;
import dev.pekelund.shop.collection.CollectionKind;
import dev.pekelund.shop.collection.ItemNotFoundException;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping(path = "/api/addresses", produces = MediaType.APPLICATION_JSON_VALUE)
public class AddressController {

    private final AddressService addressService;

    public AddressController(AddressService addressService) {
        this.addressService = addressService;
    }

    @GetMapping
    public List<AddressResponse> list() {
        return addressService.getMyAddresses().stream().map(AddressResponse::from).toList();
    }

    @GetMapping("/{id}")
    public AddressResponse get(@PathVariable("id") String id) {
        return addressService.getAddress(id)
            .map(AddressResponse::from)
            .orElseThrow(() -> new ItemNotFoundException(CollectionKind.ADDRESSES, id));
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public CreatedResponse add(@Valid @RequestBody AddressRequest request) {
        return new CreatedResponse(addressService.addAddress(request.toDraft(), request.makeDefault()));
    }

    @PatchMapping(path = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void update(@PathVariable("id") String id, @RequestBody Map<String, Object> changes) {
        addressService.updateAddress(id, changes);
    }

    @PutMapping("/{id}/default")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void setDefault(@PathVariable("id") String id) {
        addressService.setDefaultAddress(id);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable("id") String id) {
        addressService.deleteAddress(id);
    }

    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream() {
        return SnapshotEmitters.open(addressService::subscribeMyAddresses, AddressResponse::from);
    }
}
